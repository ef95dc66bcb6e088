package alpha.nomagicmvc.handler;

import alpha.nomagicmvc.message.Response;
import alpha.nomagicmvc.message.Responses;

import java.io.Serial;

import static java.util.Objects.requireNonNull;

/**
 * Thrown when a controller has no action registered under the requested name.<p>
 *
 * Thrown when calling a controller with an unknown action, in which case the
 * advisory response is 404 (Not Found). Also thrown when building a controller
 * whose pipeline references an unknown action, which is a programming error
 * that prevents the controller from being built.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class ActionNotFoundException
             extends RuntimeException implements HasResponse
{
    @Serial
    private static final long serialVersionUID = 1L;

    private final String action;

    /**
     * Initializes this object.
     *
     * @param namespace of controller
     * @param action name of action
     */
    public ActionNotFoundException(String namespace, String action) {
        super("No action \"" + action + "\" in controller \"" + namespace + "\".");
        this.action = requireNonNull(action);
    }

    /**
     * {@return the name of the action not found}
     */
    public String action() {
        return action;
    }

    /**
     * Returns {@link Responses#notFound()}.
     *
     * @return see JavaDoc
     */
    @Override
    public Response getResponse() {
        return Responses.notFound();
    }
}
