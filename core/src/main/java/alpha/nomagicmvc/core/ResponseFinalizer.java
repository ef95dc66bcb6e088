package alpha.nomagicmvc.core;

import alpha.nomagicmvc.context.InvalidStatusException;
import alpha.nomagicmvc.context.ResponseCommittedException;
import alpha.nomagicmvc.context.Status;
import alpha.nomagicmvc.message.Response;

import static alpha.nomagicmvc.HttpConstants.StatusCode.TWO_HUNDRED;
import static java.lang.System.Logger.Level.DEBUG;

/**
 * Commits the response of a context.<p>
 *
 * Committing is done exactly once per context. The status is resolved
 * (defaulting to 200) and validated, then the before-commit callbacks run,
 * and lastly the response is sealed into the context. An invalid status fails
 * the commit before any callback runs. If a callback fails, the context
 * remains uncommitted.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class ResponseFinalizer
{
    private static final System.Logger LOG
            = System.getLogger(ResponseFinalizer.class.getPackageName());

    private ResponseFinalizer() {
        // Empty
    }

    /**
     * Commits the response.
     *
     * @param ctx context to commit
     * @param operation for error messages, e.g. "render"
     * @param body of response
     *
     * @return the committed response
     *
     * @throws ResponseCommittedException
     *             if the context is already committed
     * @throws InvalidStatusException
     *             if the status put is not recognized
     */
    static Response commit(DefaultContext ctx, String operation, byte[] body) {
        ctx.requireUncommitted(operation);
        statusCode(ctx);
        ctx.runBeforeCommit();
        // A callback may have committed or put a new status
        ctx.requireUncommitted(operation);

        final int code = statusCode(ctx);
        var b = Response.builder(code);
        for (var e : ctx.respHeaders().entrySet()) {
            for (String v : e.getValue()) {
                b = b.addHeader(e.getKey(), v);
            }
        }
        Response rsp = b.body(body).build();
        ctx.seal(rsp);
        LOG.log(DEBUG, () -> "Committed " + code + " (" + operation + ") for " +
                ctx.controller().namespace() + "#" + ctx.actionName() + ".");
        return rsp;
    }

    private static int statusCode(DefaultContext ctx) {
        return ctx.status().map(Status::code).orElse(TWO_HUNDRED);
    }
}
