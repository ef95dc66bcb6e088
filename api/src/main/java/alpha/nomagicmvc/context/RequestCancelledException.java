package alpha.nomagicmvc.context;

import java.io.Serial;

/**
 * Thrown by the pipeline when it observes that the request has been cancelled
 * by the transport, for example because the client disconnected.<p>
 *
 * Cancellation is observed at stage boundaries. The remaining stages do not
 * run, the response is not committed and before-commit callbacks do not run.
 * The controller rethrows this exception to the transport; it is never
 * passed to an exception handler.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class RequestCancelledException extends RuntimeException
{
    @Serial
    private static final long serialVersionUID = 1L;

    /**
     * Initializes this object.
     *
     * @param stage name of the stage that was about to run
     */
    public RequestCancelledException(String stage) {
        super("Request cancelled before stage \"" + stage + "\".");
    }
}
