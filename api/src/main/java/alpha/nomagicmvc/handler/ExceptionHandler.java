package alpha.nomagicmvc.handler;

import alpha.nomagicmvc.Chain;
import alpha.nomagicmvc.context.Context;
import alpha.nomagicmvc.message.Response;

import static alpha.nomagicmvc.HttpConstants.StatusCode.isClientError;
import static alpha.nomagicmvc.HttpConstants.StatusCode.isRedirection;
import static alpha.nomagicmvc.HttpConstants.StatusCode.isServerError;
import static alpha.nomagicmvc.message.Responses.internalServerError;
import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.ERROR;
import static java.lang.System.Logger.Level.WARNING;

/**
 * Translates an {@code Exception} into a response.<p>
 *
 * A controller calls exception handlers to handle exceptions thrown by the
 * pipeline, be it a stage, an action, the render dispatcher or the response
 * finalizer. The exception is never retried.<p>
 *
 * The purpose of the exception handler is to cater the client with a response
 * even in the event of a failure. Therefore, the handler should return a
 * response, either by returning one directly, or yielding to the next handler
 * in the processing chain, which will eventually be the {@link #BASE}
 * handler.
 *
 * <pre>
 *   ExceptionHandler forMyExpected = (exception, chain, ctx) -&gt; {
 *       if (exception instanceof MyExpectedException familiar) {
 *           return someResponse(familiar);
 *       }
 *       // Don't know what this is, so try the next exception handler
 *       return chain.proceed();
 *   };
 * </pre>
 *
 * Exception handlers will be called in the same order they were registered with
 * the controller.<p>
 *
 * {@code RequestCancelledException} is never passed to the handlers; the
 * controller rethrows it to the transport.<p>
 *
 * The exception handler should not throw an exception. If it does, the
 * exception is logged and the client receives a 500 (Internal Server
 * Error).<p>
 *
 * The exception handler must be thread-safe, as it may be called
 * concurrently.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 *
 * @see ExceptionHandler#apply(Exception, Chain, Context)
 */
@FunctionalInterface
public interface ExceptionHandler
{
    /**
     * Produces a response.<p>
     *
     * The given exception is what this method ought to process into a response.
     * Either directly or by yielding control to the rest of the chain.<p>
     *
     * The context may have been halted or even committed, for example if the
     * action rendered twice. The response that the handler returns is the
     * response of the exchange and replaces a response committed to the
     * context.
     *
     * @param exc the exception (never null)
     * @param chain yielder of control (never null)
     * @param ctx the request context (never null)
     *
     * @return a fallback response
     *
     * @see ExceptionHandler
     */
    Response apply(Exception exc, Chain chain, Context ctx);

    /**
     * Is the last handler in the exception-processing chain.<p>
     *
     * If the exception implements {@link HasResponse}, the handler calls
     * {@link HasResponse#getResponse()} and returns the provided response.
     * For example, {@link ActionNotFoundException} gives 404 (Not Found) and
     * {@code FormatNotAcceptedException} gives 406 (Not Acceptable).<p>
     *
     * Otherwise, the exception is logged on level ERROR and
     * {@code Responses.internalServerError()} is returned.
     */
    ExceptionHandler BASE = (exc, chainIsNull, ctx) -> {
        if (exc instanceof HasResponse trait) {
            var rsp = trait.getResponse();
            int code = rsp.statusCode();
            if (!isProblem(code)) {
                logger().log(WARNING, () -> """
                    For being an advisory fallback response, \
                    the status code %s makes no sense.""".formatted(code));
                log(exc);
                return internalServerError();
            }
            logger().log(DEBUG, () ->
                "Responding %s to %s.".formatted(code, exc));
            if (isServerError(code)) {
                log(exc);
            }
            return rsp;
        }
        // Expected
        //   TemplateNotFoundException
        //   ResponseCommittedException
        //   InvalidStatusException
        //   IllegalRedirectException
        //   NoResponseException
        log(exc);
        return internalServerError();
    };

    private static boolean isProblem(int code) {
        return isRedirection(code) || isClientError(code) || isServerError(code);
    }

    private static void log(Exception exc) {
        logger().log(ERROR, "This might be interesting", exc);
    }

    private static System.Logger logger() {
        return System.getLogger(ExceptionHandler.class.getPackageName());
    }
}
