package alpha.nomagicmvc.context;

import java.io.Serial;

/**
 * Thrown by the response finalizer if the status put is not a recognized HTTP
 * status code or symbolic name.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 * @see Context#putStatus(int)
 * @see Context#putStatus(String)
 */
public final class InvalidStatusException extends RuntimeException
{
    @Serial
    private static final long serialVersionUID = 1L;

    private final String status;

    /**
     * Initializes this object.
     *
     * @param status the invalid status
     */
    public InvalidStatusException(String status) {
        super("Unrecognized status: \"" + status + "\"");
        this.status = status;
    }

    /**
     * {@return the invalid status, as put}
     */
    public String status() {
        return status;
    }
}
