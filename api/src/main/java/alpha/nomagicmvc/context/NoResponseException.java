package alpha.nomagicmvc.context;

import java.io.Serial;

/**
 * Thrown by a controller if the pipeline completed without committing a
 * response.<p>
 *
 * This is the case if neither the action nor a stage rendered, redirected or
 * sent a body, and no auto-render stage is installed for the action. A halted
 * pipeline must also commit a response before halting.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class NoResponseException extends RuntimeException
{
    @Serial
    private static final long serialVersionUID = 1L;

    /**
     * Initializes this object.
     *
     * @param namespace of controller
     * @param action name of action
     */
    public NoResponseException(String namespace, String action) {
        super("No response committed by " + namespace + "#" + action + ".");
    }
}
