package alpha.nomagicmvc.handler;

import alpha.nomagicmvc.context.Context;
import alpha.nomagicmvc.util.Throwing;

/**
 * A controller action.<p>
 *
 * An action is registered under a name with a controller and invoked by the
 * dispatch stage of the pipeline. The action reads the request from the
 * context and produces a response by calling one of the response methods, for
 * example {@link Context#render()}, {@link Context#redirect(alpha.nomagicmvc.context.Redirect)}
 * or {@link Context#json(Object)}. If the action does not commit a response,
 * the auto-render stage, when installed, renders the action's default
 * template.<p>
 *
 * <pre>
 *   Action show = ctx -> {
 *       ctx.assign("user", users.find(ctx.param("id").orElseThrow()));
 *       ctx.render();
 *   };
 * </pre>
 *
 * Any exception thrown by the action propagates to the controller's exception
 * handlers.<p>
 *
 * The implementation must be thread-safe, as it may be called concurrently.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
@FunctionalInterface
public interface Action extends Throwing.Consumer<Context, Exception>
{
    // Empty
}
