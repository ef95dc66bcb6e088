package alpha.nomagicmvc;

import alpha.nomagicmvc.handler.ExceptionHandler;
import alpha.nomagicmvc.message.Response;

/**
 * An API for proceeding the exception processing chain.<p>
 *
 * The chain is made up of zero or more application-registered
 * {@link ExceptionHandler}s leading up to the {@linkplain ExceptionHandler#BASE
 * base handler}.<p>
 *
 * The handler can short-circuit the rest of the chain by <i>not</i> calling
 * {@link #proceed()} and returning a response of its own.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
@FunctionalInterface
public interface Chain
{
    /**
     * Calls the next handler in the processing chain.
     *
     * @return the response returned from the next handler
     *
     * @throws IllegalStateException
     *             if called more than once (by the same handler)
     */
    Response proceed();
}
