package alpha.nomagicmvc.core;

import alpha.nomagicmvc.context.Context;
import alpha.nomagicmvc.context.RequestCancelledException;
import alpha.nomagicmvc.pipeline.Pipeline;
import alpha.nomagicmvc.pipeline.Stage;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static alpha.nomagicmvc.pipeline.ActionPredicate.except;
import static alpha.nomagicmvc.pipeline.ActionPredicate.only;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Small tests of {@link DefaultPipeline}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
class DefaultPipelineTest
{
    private final List<String> ran = new ArrayList<>();
    private final Context ctx = mock(Context.class);
    
    private Stage record(String name) {
        return c -> ran.add(name);
    }
    
    @Test
    void runsMatchingStagesInOrder() throws Exception {
        var p = new DefaultPipeline.DefaultBuilder()
                .register("a", record("a"))
                .register("b", record("b"), only("show"))
                .register("c", record("c"), except("show"))
                .register("d", record("d"), only("index", "show"))
                .build();
        
        assertThat(p.run(ctx, "index")).isSameAs(ctx);
        assertThat(ran).containsExactly("a", "c", "d");
        
        ran.clear();
        p.run(ctx, "show");
        assertThat(ran).containsExactly("a", "b", "d");
    }
    
    @Test
    void haltStopsPipeline() throws Exception {
        var p = new DefaultPipeline.DefaultBuilder()
                .register("a", c -> {
                    ran.add("a");
                    when(ctx.isHalted()).thenReturn(true);
                })
                .register("b", record("b"))
                .build();
        p.run(ctx, "index");
        assertThat(ran).containsExactly("a");
    }
    
    @Test
    void commitStopsPipeline() throws Exception {
        var p = new DefaultPipeline.DefaultBuilder()
                .register("a", c -> {
                    ran.add("a");
                    when(ctx.isCommitted()).thenReturn(true);
                })
                .register("b", record("b"))
                .build();
        p.run(ctx, "index");
        assertThat(ran).containsExactly("a");
    }
    
    @Test
    void cancellationObservedBeforeStage() {
        var p = new DefaultPipeline.DefaultBuilder()
                .register("a", c -> {
                    ran.add("a");
                    when(ctx.isCancelled()).thenReturn(true);
                })
                .register("b", record("b"))
                .build();
        assertThatThrownBy(() -> p.run(ctx, "index"))
                .isExactlyInstanceOf(RequestCancelledException.class)
                .hasMessage("Request cancelled before stage \"b\".");
        assertThat(ran).containsExactly("a");
    }
    
    @Test
    void exceptionAbortsRemainingStages() {
        var p = new DefaultPipeline.DefaultBuilder()
                .register("a", c -> { throw new IOException("boom"); })
                .register("b", record("b"))
                .build();
        assertThatThrownBy(() -> p.run(ctx, "index"))
                .isExactlyInstanceOf(IOException.class)
                .hasMessage("boom");
        assertThat(ran).isEmpty();
    }
    
    @Test
    void emptyPipeline() throws Exception {
        Pipeline p = new DefaultPipeline.DefaultBuilder().build();
        assertThat(p.run(ctx, "index")).isSameAs(ctx);
        assertThat(p.registrations()).isEmpty();
    }
    
    @Test
    void duplicatedName() {
        var b = new DefaultPipeline.DefaultBuilder().register("a", record("a"));
        assertThatThrownBy(() -> b.register("a", record("x")))
                .isExactlyInstanceOf(IllegalArgumentException.class)
                .hasMessage("Stage \"a\" is already registered.");
    }
    
    @Test
    void emptyName() {
        assertThatThrownBy(() -> new DefaultPipeline.DefaultBuilder().register("", record("a")))
                .isExactlyInstanceOf(IllegalArgumentException.class)
                .hasMessage("Empty stage name.");
    }
    
    @Test
    void toBuilderLeavesOriginalUnaffected() throws Exception {
        var p1 = new DefaultPipeline.DefaultBuilder().register("a", record("a")).build();
        var p2 = p1.toBuilder().register("b", record("b")).build();
        assertThat(p1.registrations()).extracting(Pipeline.Registration::name)
                .containsExactly("a");
        assertThat(p2.registrations()).extracting(Pipeline.Registration::name)
                .containsExactly("a", "b");
        p2.run(ctx, "index");
        assertThat(ran).containsExactly("a", "b");
    }
    
    @Test
    void stagesNotRunGetNoContext() throws Exception {
        Stage s = mock(Stage.class);
        new DefaultPipeline.DefaultBuilder()
                .register("skipped", s, only("other"))
                .build()
                .run(ctx, "index");
        verifyNoInteractions(s);
    }
}
