package alpha.nomagicmvc.context;

import java.io.Serial;

/**
 * Thrown when attempting to mutate the response of a context that has already
 * been committed.<p>
 *
 * Rendering twice, redirecting after render and putting a header after a
 * redirect are all programming errors that result in this exception.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 * @see Context#isCommitted()
 */
public final class ResponseCommittedException extends RuntimeException
{
    @Serial
    private static final long serialVersionUID = 1L;

    /**
     * Initializes this object.
     *
     * @param operation attempted
     */
    public ResponseCommittedException(String operation) {
        super("Response already committed, can not " + operation + ".");
    }
}
