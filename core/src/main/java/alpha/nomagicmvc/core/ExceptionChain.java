package alpha.nomagicmvc.core;

import alpha.nomagicmvc.Chain;
import alpha.nomagicmvc.context.Context;
import alpha.nomagicmvc.handler.ExceptionHandler;
import alpha.nomagicmvc.message.Response;

import java.util.Collection;
import java.util.Iterator;

import static alpha.nomagicmvc.handler.ExceptionHandler.BASE;
import static java.util.Objects.requireNonNull;

/**
 * Provides {@code Chain.proceed} verification.<p>
 *
 * All calls to {@link Chain#proceed() proceed} are routed to the next
 * application-registered handler until there are no more, which is when the
 * {@link ExceptionHandler#BASE base handler} executes.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class ExceptionChain
{
    private final Iterator<ExceptionHandler> handlers;
    private final Exception exc;
    private final Context ctx;

    ExceptionChain(Collection<ExceptionHandler> handlers, Exception exc, Context ctx) {
        this.handlers = handlers.iterator();
        this.exc = exc;
        this.ctx = ctx;
    }

    Response ignite() {
        return proceed0();
    }

    private Response proceed0() {
        if (!handlers.hasNext()) {
            return BASE.apply(exc, null, ctx);
        }
        var h = handlers.next();
        var yielded = new boolean[1];
        Chain passMeThrough = () -> {
            if (yielded[0]) {
                throw new IllegalStateException(
                        Chain.class.getSimpleName() + ".proceed() was already called");
            }
            yielded[0] = true;
            // Recursive
            return proceed0();
        };
        return requireNonNull(h.apply(exc, passMeThrough, ctx),
                "Exception handler returned null");
    }
}
