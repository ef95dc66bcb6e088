package alpha.nomagicmvc.pipeline;

import alpha.nomagicmvc.context.Context;
import alpha.nomagicmvc.util.Throwing;

/**
 * A named step of a {@link Pipeline}.<p>
 *
 * A stage mutates the context it is given. It may assign template variables,
 * fetch the session, put response headers, commit a response or halt the
 * pipeline:
 *
 * <pre>
 *   Stage requireUser = ctx -&gt; {
 *       ctx.fetchSession();
 *       if (ctx.getSession("user_id").isEmpty()) {
 *           ctx.redirect(Redirect.to("/login"));
 *           ctx.halt();
 *       }
 *   };
 * </pre>
 *
 * An exception thrown by the stage aborts the pipeline and propagates to the
 * controller's exception handlers.<p>
 *
 * The stage is shared by all requests and must be thread-safe.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 * @see Stages
 */
@FunctionalInterface
public interface Stage extends Throwing.Consumer<Context, Exception>
{
    // Empty
}
