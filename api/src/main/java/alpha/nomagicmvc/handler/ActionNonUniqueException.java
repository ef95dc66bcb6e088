package alpha.nomagicmvc.handler;

import java.io.Serial;

/**
 * Thrown when building a controller with two actions of the same name.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class ActionNonUniqueException extends RuntimeException
{
    @Serial
    private static final long serialVersionUID = 1L;

    /**
     * Initializes this object.
     *
     * @param namespace of controller
     * @param action name of action
     */
    public ActionNonUniqueException(String namespace, String action) {
        super("Action \"" + action + "\" already registered in controller \"" + namespace + "\".");
    }
}
