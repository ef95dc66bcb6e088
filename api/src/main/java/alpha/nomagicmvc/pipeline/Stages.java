package alpha.nomagicmvc.pipeline;

import alpha.nomagicmvc.context.Context;
import alpha.nomagicmvc.handler.ActionNotFoundException;
import alpha.nomagicmvc.render.Format;

import java.util.List;

import static alpha.nomagicmvc.HttpConstants.HeaderName.REFERRER_POLICY;
import static alpha.nomagicmvc.HttpConstants.HeaderName.X_CONTENT_TYPE_OPTIONS;
import static alpha.nomagicmvc.HttpConstants.HeaderName.X_DOWNLOAD_OPTIONS;
import static alpha.nomagicmvc.HttpConstants.HeaderName.X_FRAME_OPTIONS;
import static alpha.nomagicmvc.HttpConstants.HeaderName.X_PERMITTED_CROSS_DOMAIN_POLICIES;
import static alpha.nomagicmvc.HttpConstants.HeaderName.X_XSS_PROTECTION;
import static java.util.Objects.requireNonNull;

/**
 * Built-in stages.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class Stages
{
    private Stages() {
        // Empty
    }

    /**
     * The name {@link #DISPATCH} is registered under, when the controller
     * appends it.
     */
    public static final String DISPATCH_NAME = "dispatch";

    /**
     * Invokes the action of the context.<p>
     *
     * A controller whose pipeline has no dispatch stage appends one.
     *
     * @throws ActionNotFoundException if the controller has no such action
     */
    public static final Stage DISPATCH = ctx -> ctx.controller()
            .action(ctx.actionName())
            .orElseThrow(() -> new ActionNotFoundException(
                    ctx.controller().namespace(), ctx.actionName()))
            .accept(ctx);

    private static final Stage
            AUTO_RENDER  = ctx -> {
                if (!ctx.isCommitted()) {
                    ctx.render();
                }
            },
            FETCH_SESSION = Context::fetchSession,
            FETCH_FLASH   = Context::fetchFlash,
            NO_LAYOUT     = Context::putNoLayout,
            SECURE_BROWSER_HEADERS = ctx -> ctx
                    .putRespHeader(X_FRAME_OPTIONS, "SAMEORIGIN")
                    .putRespHeader(X_XSS_PROTECTION, "1; mode=block")
                    .putRespHeader(X_CONTENT_TYPE_OPTIONS, "nosniff")
                    .putRespHeader(X_DOWNLOAD_OPTIONS, "noopen")
                    .putRespHeader(X_PERMITTED_CROSS_DOMAIN_POLICIES, "none")
                    .putRespHeader(REFERRER_POLICY, "strict-origin-when-cross-origin");

    /**
     * Returns a stage that renders the action's template, unless a response
     * has already been committed.
     *
     * @return a stage
     */
    public static Stage autoRender() {
        return AUTO_RENDER;
    }

    /**
     * Returns a stage that narrows the formats accepted for the request.
     *
     * @param formats to accept, in order of preference
     * @return a stage
     * @throws NullPointerException if an element is {@code null}
     * @throws IllegalArgumentException if no format is given
     */
    public static Stage acceptFormats(Format... formats) {
        final List<Format> copy = List.of(formats);
        if (copy.isEmpty()) {
            throw new IllegalArgumentException("No formats.");
        }
        return ctx -> ctx.acceptFormats(copy.toArray(Format[]::new));
    }

    /**
     * {@return a stage that fetches the session}
     *
     * @see Context#fetchSession()
     */
    public static Stage fetchSession() {
        return FETCH_SESSION;
    }

    /**
     * {@return a stage that fetches the flash (and the session)}
     *
     * @see Context#fetchFlash()
     */
    public static Stage fetchFlash() {
        return FETCH_FLASH;
    }

    /**
     * Returns a stage that sets the layout.
     *
     * @param name of layout
     * @return a stage
     * @throws NullPointerException if {@code name} is {@code null}
     */
    public static Stage putLayout(String name) {
        requireNonNull(name);
        return ctx -> ctx.putLayout(name);
    }

    /**
     * {@return a stage that disables the layout}
     */
    public static Stage noLayout() {
        return NO_LAYOUT;
    }

    /**
     * Returns a stage that sets the template namespace.
     *
     * @param namespace of templates
     * @return a stage
     * @throws NullPointerException if {@code namespace} is {@code null}
     */
    public static Stage putView(String namespace) {
        requireNonNull(namespace);
        return ctx -> ctx.putView(namespace);
    }

    /**
     * Returns a stage that puts headers instructing browsers to enable
     * security features.<p>
     *
     * The headers are:
     * <pre>
     *   X-Frame-Options: SAMEORIGIN
     *   X-XSS-Protection: 1; mode=block
     *   X-Content-Type-Options: nosniff
     *   X-Download-Options: noopen
     *   X-Permitted-Cross-Domain-Policies: none
     *   Referrer-Policy: strict-origin-when-cross-origin
     * </pre>
     *
     * @return a stage
     */
    public static Stage putSecureBrowserHeaders() {
        return SECURE_BROWSER_HEADERS;
    }
}
