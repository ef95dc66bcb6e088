package alpha.nomagicmvc.core;

import alpha.nomagicmvc.Config;
import alpha.nomagicmvc.Controller;
import alpha.nomagicmvc.context.Context;
import alpha.nomagicmvc.context.InvalidStatusException;
import alpha.nomagicmvc.context.NoResponseException;
import alpha.nomagicmvc.context.Redirect;
import alpha.nomagicmvc.context.RequestCancelledException;
import alpha.nomagicmvc.context.ResponseCommittedException;
import alpha.nomagicmvc.handler.ActionNonUniqueException;
import alpha.nomagicmvc.handler.ActionNotFoundException;
import alpha.nomagicmvc.handler.ExceptionHandler;
import alpha.nomagicmvc.message.Request;
import alpha.nomagicmvc.message.Response;
import alpha.nomagicmvc.message.Responses;
import alpha.nomagicmvc.pipeline.Pipeline;
import alpha.nomagicmvc.pipeline.Stages;
import alpha.nomagicmvc.render.FormatNotAcceptedException;
import alpha.nomagicmvc.render.TemplateNotFoundException;
import alpha.nomagicmvc.testutil.LogRecorder;
import alpha.nomagicmvc.testutil.TestRequests;
import alpha.nomagicmvc.testutil.TestSessions;
import alpha.nomagicmvc.testutil.TestTemplates;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;

import static alpha.nomagicmvc.HttpConstants.HeaderName.CONTENT_TYPE;
import static alpha.nomagicmvc.HttpConstants.HeaderName.LOCATION;
import static alpha.nomagicmvc.HttpConstants.HeaderName.X_FRAME_OPTIONS;
import static alpha.nomagicmvc.HttpConstants.Method.GET;
import static alpha.nomagicmvc.pipeline.ActionPredicate.only;
import static alpha.nomagicmvc.render.Format.HTML;
import static alpha.nomagicmvc.render.Format.JSON;
import static alpha.nomagicmvc.render.Format.TEXT;
import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.ERROR;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests of {@link DefaultController}, driving the whole pipeline.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
class DefaultControllerTest
{
    private LogRecorder log;
    
    private final TestTemplates templates = new TestTemplates()
            .add("users/index.html", "<ul>{{count}}</ul>")
            .add("users/show.html", "<p>show</p>")
            .add("layouts/app.html", "<main>{{inner_content}}</main>");
    
    @BeforeEach
    void startRecording() {
        log = LogRecorder.startRecording(ExceptionHandler.class, DefaultController.class);
    }
    
    @AfterEach
    void stopRecording() {
        log.stopRecording();
    }
    
    private Controller.Builder users() {
        return Controller.builder("users")
                .templates(templates)
                .plug("formats", Stages.acceptFormats(HTML, TEXT))
                .plug(Stages.DISPATCH_NAME, Stages.DISPATCH)
                .plug("render", Stages.autoRender(), only("index"));
    }
    
    @Nested
    class Scenarios {
        @Test
        void indexIsAutoRenderedInDefaultLayout() {
            var rsp = users()
                    .action("index", ctx -> ctx.assign("count", 7))
                    .action("show", ctx -> ctx.render("show.html"))
                    .build()
                    .call(TestRequests.get("/users"), "index");
            assertThat(rsp.statusCode()).isEqualTo(200);
            assertThat(rsp.bodyAsString()).isEqualTo("<main><ul>7</ul></main>");
            assertThat(rsp.header(CONTENT_TYPE)).hasValue("text/html; charset=utf-8");
            assertThat(templates.requested())
                    .containsExactly("users/index.html", "layouts/app.html");
            log.assertNoProblem();
        }
        
        @Test
        void showRendersItselfWithoutDoubleRender() {
            var rsp = users()
                    .action("index", ctx -> {})
                    .action("show", ctx -> ctx.render("show.html"))
                    .build()
                    .call(TestRequests.get("/users/1"), "show");
            assertThat(rsp.statusCode()).isEqualTo(200);
            assertThat(rsp.bodyAsString()).isEqualTo("<main><p>show</p></main>");
            log.assertNoProblem();
        }
        
        @Test
        void renderAfterRedirectIsDoubleCommit() {
            var observed = new ArrayList<Response>();
            var rsp = users()
                    .action("index", ctx -> {})
                    .action("create", ctx -> {
                        ctx.redirect(Redirect.to("/redirect_test"));
                        observed.add(ctx.response().orElseThrow());
                        ctx.render("index");
                    })
                    .build()
                    .call(TestRequests.post("/users"), "create");
            
            var redirect = observed.get(0);
            assertThat(redirect.statusCode()).isEqualTo(302);
            assertThat(redirect.header(LOCATION)).hasValue("/redirect_test");
            assertThat(redirect.body()).isEmpty();
            
            assertThat(rsp.statusCode()).isEqualTo(500);
            log.assertRemove(ERROR, "This might be interesting", ResponseCommittedException.class)
               .hasMessage("Response already committed, can not render.");
        }
        
        @Test
        void unacceptedFormatIs406BeforeLookup() {
            var req = Request.builder(GET, "/users").param("_format", "xml").build();
            var rsp = users()
                    .action("index", ctx -> {})
                    .build()
                    .call(req, "index");
            assertThat(rsp.statusCode()).isEqualTo(406);
            assertThat(templates.requested()).isEmpty();
            log.assertRemove(DEBUG, "Responding 406 to " + FormatNotAcceptedException.class.getName())
               .assertNoProblem();
        }
    }
    
    @Nested
    class Failures {
        @Test
        void unknownAction() {
            var rsp = users().action("index", ctx -> {}).build()
                    .call(TestRequests.get("/"), "nope");
            assertThat(rsp.statusCode()).isEqualTo(404);
            log.assertNoProblem();
        }
        
        @Test
        void templateMissIs500() {
            var rsp = users().action("index", ctx -> ctx.render("gone")).build()
                    .call(TestRequests.get("/"), "index");
            assertThat(rsp.statusCode()).isEqualTo(500);
            log.assertRemove(ERROR, "This might be interesting", TemplateNotFoundException.class)
               .hasMessage("Template not found: users/gone.html");
        }
        
        @Test
        void noResponse() {
            var rsp = Controller.builder("users")
                    .templates(templates)
                    .action("index", ctx -> {})
                    .build()
                    .call(TestRequests.get("/"), "index");
            assertThat(rsp.statusCode()).isEqualTo(500);
            log.assertRemove(ERROR, "This might be interesting", NoResponseException.class)
               .hasMessage("No response committed by users#index.");
        }
        
        @Test
        void haltedWithoutCommitIsNoResponse() {
            var ran = new ArrayList<String>();
            var rsp = Controller.builder("users")
                    .templates(templates)
                    .plug("auth", Context::halt)
                    .action("index", ctx -> ran.add("index"))
                    .build()
                    .call(TestRequests.get("/"), "index");
            assertThat(ran).isEmpty();
            assertThat(rsp.statusCode()).isEqualTo(500);
            log.assertRemoveThrown().isExactlyInstanceOf(NoResponseException.class);
        }
        
        @Test
        void haltedWithCommit() {
            var rsp = Controller.builder("users")
                    .templates(templates)
                    .plug("auth", ctx -> ctx.putStatus(401).text("Who are you?").halt())
                    .action("index", ctx -> { throw new AssertionError(); })
                    .build()
                    .call(TestRequests.get("/"), "index");
            assertThat(rsp.statusCode()).isEqualTo(401);
            assertThat(rsp.bodyAsString()).isEqualTo("Who are you?");
            log.assertNoProblem();
        }
        
        @Test
        void invalidStatusKeepsSessionUntouched() {
            var sessions = new TestSessions();
            var rsp = Controller.builder("users")
                    .templates(templates)
                    .sessions(sessions)
                    .plug("session", Stages.fetchSession())
                    .action("index", ctx -> ctx.putSession("user", "x").putStatus(999).text("x"))
                    .build()
                    .call(TestRequests.get("/"), "index");
            assertThat(rsp.statusCode()).isEqualTo(500);
            assertThat(sessions.saves()).isZero();
            assertThat(sessions.stored()).isEmpty();
            log.assertRemove(ERROR, "This might be interesting", InvalidStatusException.class)
               .hasMessage("Unrecognized status: \"999\"");
        }
        
        @Test
        void acceptWithCharsetParameter() {
            var json = new TestTemplates().add("users/index.json", "{}");
            var req = Request.builder(GET, "/users")
                    .header("Accept", "application/json; charset=utf-8")
                    .build();
            var rsp = Controller.builder("users")
                    .templates(json)
                    .plug("formats", Stages.acceptFormats(HTML, JSON))
                    .action("index", ctx -> ctx.render())
                    .build()
                    .call(req, "index");
            assertThat(rsp.statusCode()).isEqualTo(200);
            assertThat(rsp.bodyAsString()).isEqualTo("{}");
            assertThat(json.requested()).containsExactly("users/index.json");
        }
        
        @Test
        void cancelledIsRethrown() {
            var c = users().action("index", ctx -> {}).build();
            assertThatThrownBy(() -> c.call(TestRequests.get("/"), "index", () -> true))
                    .isExactlyInstanceOf(RequestCancelledException.class)
                    .hasMessage("Request cancelled before stage \"formats\".");
        }
        
        @Test
        void cancelledSkipsBeforeCommitCallbacks() {
            var sessions = new TestSessions();
            var cancel = new boolean[1];
            var c = Controller.builder("users")
                    .templates(templates)
                    .sessions(sessions)
                    .plug("session", Stages.fetchSession())
                    .plug("write", ctx -> {
                        ctx.putSession("k", "v");
                        cancel[0] = true;
                    })
                    .action("index", ctx -> ctx.text("x"))
                    .build();
            assertThatThrownBy(() -> c.call(TestRequests.get("/"), "index", () -> cancel[0]))
                    .isExactlyInstanceOf(RequestCancelledException.class);
            assertThat(sessions.saves()).isZero();
        }
    }
    
    @Nested
    class Handlers {
        @Test
        void calledInOrderThenBase() {
            var seen = new ArrayList<String>();
            var rsp = users()
                    .action("index", ctx -> { throw new IllegalStateException("oops"); })
                    .exceptionHandler((exc, chain, ctx) -> {
                        seen.add("one");
                        return chain.proceed();
                    })
                    .exceptionHandler((exc, chain, ctx) -> {
                        seen.add("two");
                        return exc instanceof IllegalStateException ?
                                Responses.text(exc.getMessage()) : chain.proceed();
                    })
                    .build()
                    .call(TestRequests.get("/"), "index");
            assertThat(seen).containsExactly("one", "two");
            assertThat(rsp.bodyAsString()).isEqualTo("oops");
            log.assertNoProblem();
        }
        
        @Test
        void throwingHandlerGives500() {
            var rsp = users()
                    .action("index", ctx -> { throw new IllegalStateException("oops"); })
                    .exceptionHandler((exc, chain, ctx) -> {
                        throw new UnsupportedOperationException("handler broke");
                    })
                    .build()
                    .call(TestRequests.get("/"), "index");
            assertThat(rsp.statusCode()).isEqualTo(500);
            log.assertRemove(ERROR, "Exception processing chain failed to handle this",
                        IllegalStateException.class)
               .hasSuppressedException(new UnsupportedOperationException("handler broke"));
        }
        
        @Test
        void proceedTwice() {
            var rsp = users()
                    .action("index", ctx -> { throw new IllegalStateException("oops"); })
                    .exceptionHandler((exc, chain, ctx) -> {
                        chain.proceed();
                        return chain.proceed();
                    })
                    .build()
                    .call(TestRequests.get("/"), "index");
            assertThat(rsp.statusCode()).isEqualTo(500);
            log.assertRemove(ERROR, "Exception processing chain failed to handle this");
        }
        
        @Test
        void handlerMaySeeCommittedContext() {
            var committed = new boolean[1];
            var rsp = users()
                    .action("index", ctx -> {
                        ctx.text("one");
                        ctx.text("two");
                    })
                    .exceptionHandler((exc, chain, ctx) -> {
                        committed[0] = ctx.isCommitted();
                        return ctx.response().orElseThrow();
                    })
                    .build()
                    .call(TestRequests.get("/"), "index");
            assertThat(committed[0]).isTrue();
            assertThat(rsp.bodyAsString()).isEqualTo("one");
        }
    }
    
    @Nested
    class Building {
        @Test
        void dispatchIsAppended() {
            var c = Controller.builder("users")
                    .templates(templates)
                    .plug("a", ctx -> {})
                    .action("index", ctx -> ctx.text("hi"))
                    .build();
            assertThat(c.pipeline().registrations())
                    .extracting(Pipeline.Registration::name)
                    .containsExactly("a", "dispatch");
            assertThat(c.call(TestRequests.get("/"), "index").bodyAsString()).isEqualTo("hi");
        }
        
        @Test
        void dispatchNotAppendedTwice() {
            var c = users().action("index", ctx -> {}).build();
            assertThat(c.pipeline().registrations())
                    .extracting(Pipeline.Registration::name)
                    .containsExactly("formats", "dispatch", "render");
        }
        
        @Test
        void sharedPipeline() {
            var shared = Pipeline.builder()
                    .register("secure", Stages.putSecureBrowserHeaders())
                    .build();
            var rsp = Controller.builder("users")
                    .templates(templates)
                    .pipeline(shared)
                    .action("index", ctx -> ctx.text("x"))
                    .build()
                    .call(TestRequests.get("/"), "index");
            assertThat(rsp.header(X_FRAME_OPTIONS)).hasValue("SAMEORIGIN");
            assertThat(rsp.header("Referrer-Policy")).hasValue("strict-origin-when-cross-origin");
        }
        
        @Test
        void duplicatedAction() {
            var b = Controller.builder("users").action("index", ctx -> {});
            assertThatThrownBy(() -> b.action("index", ctx -> {}))
                    .isExactlyInstanceOf(ActionNonUniqueException.class)
                    .hasMessage("Action \"index\" already registered in controller \"users\".");
        }
        
        @Test
        void predicateNamesUnknownAction() {
            var b = Controller.builder("users")
                    .templates(templates)
                    .action("index", ctx -> {})
                    .plug("render", Stages.autoRender(), only("index", "shwo"));
            assertThatThrownBy(b::build)
                    .isExactlyInstanceOf(ActionNotFoundException.class)
                    .hasMessage("No action \"shwo\" in controller \"users\".");
        }
        
        @Test
        void templatesRequired() {
            var b = Controller.builder("users").action("index", ctx -> {});
            assertThatThrownBy(b::build)
                    .isExactlyInstanceOf(NullPointerException.class)
                    .hasMessage("templates");
        }
        
        @Test
        void emptyNamespace() {
            assertThatThrownBy(() -> Controller.builder(""))
                    .isExactlyInstanceOf(IllegalArgumentException.class)
                    .hasMessage("Empty namespace.");
        }
        
        @Test
        void actionNames() {
            var c = users().action("index", ctx -> {}).action("show", ctx -> {}).build();
            assertThat(c.actionNames()).containsExactlyInAnyOrder("index", "show");
            assertThat(c.action("show")).isPresent();
            assertThat(c.action("edit")).isEmpty();
            assertThat(c.config()).isSameAs(Config.DEFAULT);
            assertThat(c.sessions()).isEmpty();
        }
    }
    
    @Test
    void sessionAndFlashAcrossRedirect() {
        var sessions = new TestSessions();
        var c = Controller.builder("users")
                .templates(templates)
                .sessions(sessions)
                .plug("flash", Stages.fetchFlash())
                .action("create", ctx -> {
                    ctx.flash().put("info", "Created.");
                    ctx.redirect(Redirect.to("/users"));
                })
                .action("index", ctx -> ctx.text(String.join(",", ctx.flash().getAll("info"))))
                .build();
        
        var one = c.call(TestRequests.post("/users", "name", "Alice"), "create");
        assertThat(one.statusCode()).isEqualTo(302);
        
        var two = c.call(TestRequests.get("/users"), "index");
        assertThat(two.bodyAsString()).isEqualTo("Created.");
        
        var three = c.call(TestRequests.get("/users"), "index");
        assertThat(three.bodyAsString()).isEmpty();
        log.assertNoProblem();
    }
    
    @Test
    void interruptedThreadIsCancelled() {
        var c = users().action("index", ctx -> {}).build();
        Thread.currentThread().interrupt();
        try {
            assertThatThrownBy(() -> c.call(TestRequests.get("/"), "index"))
                    .isExactlyInstanceOf(RequestCancelledException.class);
        } finally {
            // Clear flag
            assertThat(Thread.interrupted()).isTrue();
        }
    }
    
    @Test
    void exceptionsHandledByPipelineAreNotRetried() {
        var calls = new int[1];
        var rsp = users()
                .action("index", ctx -> {
                    ++calls[0];
                    throw new IllegalStateException();
                })
                .build()
                .call(TestRequests.get("/"), "index");
        assertThat(calls[0]).isEqualTo(1);
        assertThat(rsp.statusCode()).isEqualTo(500);
        log.assertRemoveThrown().isExactlyInstanceOf(IllegalStateException.class);
        assertThat(rsp.body()).isEmpty();
    }
}
