package alpha.nomagicmvc.core;

import alpha.nomagicmvc.context.Context;
import alpha.nomagicmvc.context.IllegalRedirectException;
import alpha.nomagicmvc.handler.ActionNotFoundException;
import alpha.nomagicmvc.handler.ExceptionHandler;
import alpha.nomagicmvc.handler.HasResponse;
import alpha.nomagicmvc.message.Response;
import alpha.nomagicmvc.message.Responses;
import alpha.nomagicmvc.render.Format;
import alpha.nomagicmvc.render.FormatNotAcceptedException;
import alpha.nomagicmvc.testutil.LogRecorder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.ERROR;
import static java.lang.System.Logger.Level.WARNING;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.mock;

/**
 * Tests of {@link ExceptionChain} and {@link ExceptionHandler#BASE}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
class ExceptionChainTest
{
    private final Context ctx = mock(Context.class);
    private LogRecorder log;
    
    @BeforeEach
    void startRecording() {
        log = LogRecorder.startRecording(ExceptionHandler.class);
    }
    
    @AfterEach
    void stopRecording() {
        log.stopRecording();
    }
    
    private Response ignite(Exception exc, ExceptionHandler... handlers) {
        return new ExceptionChain(List.of(handlers), exc, ctx).ignite();
    }
    
    @Test
    void handlersInOrder() {
        var seen = new ArrayList<Integer>();
        var rsp = ignite(new RuntimeException(),
                (e, ch, c) -> { seen.add(1); return ch.proceed(); },
                (e, ch, c) -> { seen.add(2); return Responses.noContent(); },
                (e, ch, c) -> { seen.add(3); return ch.proceed(); });
        assertThat(seen).containsExactly(1, 2);
        assertEquals(204, rsp.statusCode());
        log.assertNoProblem();
    }
    
    @Test
    void handlerReceivesExceptionAndContext() {
        var exc = new RuntimeException();
        ignite(exc, (e, ch, c) -> {
            assertThat(e).isSameAs(exc);
            assertThat(c).isSameAs(ctx);
            return Responses.ok();
        });
    }
    
    @Test
    void proceedTwice() {
        assertThatThrownBy(() -> ignite(new RuntimeException(), (e, ch, c) -> {
                    ch.proceed();
                    return ch.proceed();
                }))
                .isExactlyInstanceOf(IllegalStateException.class)
                .hasMessage("Chain.proceed() was already called");
    }
    
    @Test
    void nullResponse() {
        assertThatThrownBy(() -> ignite(new RuntimeException(), (e, ch, c) -> null))
                .isExactlyInstanceOf(NullPointerException.class)
                .hasMessage("Exception handler returned null");
    }
    
    @Test
    void base_actionNotFound() {
        var rsp = ignite(new ActionNotFoundException("users", "x"));
        assertEquals(404, rsp.statusCode());
        log.assertRemove(DEBUG, "Responding 404 to ")
           .assertNoProblem();
    }
    
    @Test
    void base_formatNotAccepted() {
        var rsp = ignite(new FormatNotAcceptedException("xml", List.of(Format.HTML)));
        assertEquals(406, rsp.statusCode());
        log.assertNoProblem();
    }
    
    @Test
    void base_unknown() {
        var rsp = ignite(new IllegalRedirectException("Empty redirect location."));
        assertEquals(500, rsp.statusCode());
        log.assertRemove(ERROR, "This might be interesting", IllegalRedirectException.class)
           .hasMessage("Empty redirect location.");
    }
    
    @Test
    void base_serverErrorIsLogged() {
        var rsp = ignite(new Oops(503));
        assertEquals(503, rsp.statusCode());
        log.assertRemove(ERROR, "This might be interesting", Oops.class);
    }
    
    @Test
    void base_successCodeMakesNoSense() {
        var rsp = ignite(new Oops(200));
        assertEquals(500, rsp.statusCode());
        log.assertRemove(WARNING,
                "For being an advisory fallback response, the status code 200 makes no sense.")
           .assertRemove(ERROR, "This might be interesting", Oops.class);
    }
    
    private static final class Oops extends RuntimeException
            implements HasResponse
    {
        private static final long serialVersionUID = 1L;
        private final transient Response rsp;
        
        Oops(int code) {
            rsp = Responses.status(code);
        }
        
        @Override
        public Response getResponse() {
            return rsp;
        }
    }
}
