package alpha.nomagicmvc.handler;

import alpha.nomagicmvc.message.Response;

/**
 * Adds {@link #getResponse()}.<p>
 *
 * This interface is intended to be implemented by exception classes that map
 * to a specific HTTP problem. The {@linkplain ExceptionHandler#BASE base
 * exception handler}, if given an exception that implements
 * {@code HasResponse}, returns the response provided, unmodified.<p>
 *
 * The response is advisory. An application-registered exception handler is
 * free to return a different one.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public interface HasResponse {
    /**
     * Returns an advisory, fallback response for the exception handler.<p>
     *
     * The exception class should never return a response indicating success.
     *
     * @apiNote
     * The "get" prefix is to be consistent with {@code Throwable}'s API design.
     *
     * @return an advisory fallback response (never {@code null})
     */
    Response getResponse();
}
