package alpha.nomagicmvc.core;

import alpha.nomagicmvc.context.Context;
import alpha.nomagicmvc.context.RequestCancelledException;
import alpha.nomagicmvc.pipeline.ActionPredicate;
import alpha.nomagicmvc.pipeline.Pipeline;
import alpha.nomagicmvc.pipeline.Stage;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static java.lang.System.Logger.Level.DEBUG;
import static java.util.Objects.requireNonNull;

/**
 * Default implementation of {@link Pipeline}.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class DefaultPipeline implements Pipeline
{
    private static final System.Logger LOG
            = System.getLogger(DefaultPipeline.class.getPackageName());

    private final List<Registration> regs;

    private DefaultPipeline(List<Registration> regs) {
        this.regs = List.copyOf(regs);
    }

    @Override
    public List<Registration> registrations() {
        return regs;
    }

    @Override
    public Pipeline.Builder toBuilder() {
        var b = new DefaultBuilder();
        regs.forEach(r -> b.register(r.name(), r.stage(), r.predicate()));
        return b;
    }

    @Override
    public Context run(Context ctx, String action) throws Exception {
        requireNonNull(ctx);
        requireNonNull(action);
        for (Registration r : regs) {
            if (ctx.isHalted() || ctx.isCommitted()) {
                LOG.log(DEBUG, () -> "Stopped before stage \"" + r.name() +
                        "\", context " + (ctx.isHalted() ? "halted." : "committed."));
                break;
            }
            if (ctx.isCancelled()) {
                throw new RequestCancelledException(r.name());
            }
            if (!r.predicate().test(action)) {
                LOG.log(DEBUG, () -> "Skipping stage \"" + r.name() +
                        "\" for action \"" + action + "\", predicate " + r.predicate() + ".");
                continue;
            }
            LOG.log(DEBUG, () -> "Running stage \"" + r.name() + "\".");
            r.stage().accept(ctx);
        }
        return ctx;
    }

    @Override
    public String toString() {
        return DefaultPipeline.class.getSimpleName() + "{" +
                regs.stream().map(Registration::name).toList() + "}";
    }

    static final class DefaultBuilder implements Pipeline.Builder
    {
        private final List<Registration> regs = new ArrayList<>();
        private final Set<String> names = new HashSet<>();

        @Override
        public Pipeline.Builder register(String name, Stage stage, ActionPredicate predicate) {
            var r = new Registration(name, stage, predicate);
            if (name.isEmpty()) {
                throw new IllegalArgumentException("Empty stage name.");
            }
            if (!names.add(name)) {
                throw new IllegalArgumentException(
                        "Stage \"" + name + "\" is already registered.");
            }
            regs.add(r);
            return this;
        }

        /**
         * Returns {@code true} if the given stage instance is registered.
         */
        boolean contains(Stage stage) {
            return regs.stream().anyMatch(r -> r.stage() == stage);
        }

        @Override
        public Pipeline build() {
            return new DefaultPipeline(regs);
        }
    }
}
