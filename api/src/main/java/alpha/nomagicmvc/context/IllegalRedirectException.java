package alpha.nomagicmvc.context;

import java.io.Serial;

/**
 * Thrown when a redirect destination does not match the kind of redirect.<p>
 *
 * An internal redirect must be a raw path ("/users/42"), not a full URL. An
 * external redirect must be an absolute URL ("https://example.com/").
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 * @see Redirect
 */
public final class IllegalRedirectException extends IllegalArgumentException
{
    @Serial
    private static final long serialVersionUID = 1L;

    /**
     * Initializes this object.
     *
     * @param message detail
     */
    public IllegalRedirectException(String message) {
        super(message);
    }

    /**
     * Initializes this object.
     *
     * @param message detail
     * @param cause of failure
     */
    public IllegalRedirectException(String message, Throwable cause) {
        super(message, cause);
    }
}
