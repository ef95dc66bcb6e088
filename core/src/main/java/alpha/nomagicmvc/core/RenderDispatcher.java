package alpha.nomagicmvc.core;

import alpha.nomagicmvc.Config;
import alpha.nomagicmvc.context.ResponseCommittedException;
import alpha.nomagicmvc.render.Format;
import alpha.nomagicmvc.render.FormatNotAcceptedException;
import alpha.nomagicmvc.render.TemplateEngine;
import alpha.nomagicmvc.render.TemplateKey;
import alpha.nomagicmvc.render.TemplateNotFoundException;

import java.util.LinkedHashMap;
import java.util.Map;

import static alpha.nomagicmvc.HttpConstants.HeaderName.CONTENT_TYPE;
import static java.lang.System.Logger.Level.DEBUG;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Collections.unmodifiableMap;

/**
 * Renders a template into the response of a context.<p>
 *
 * A template reference is resolved as follows:
 * <pre>
 *   null        &lt;view&gt;/&lt;action&gt;.&lt;negotiated format&gt;
 *   "name"      &lt;view&gt;/name.&lt;negotiated format&gt;
 *   "name.fmt"  &lt;view&gt;/name.fmt (explicit format)
 * </pre>
 *
 * The format, negotiated or explicit, must be accepted before any template is
 * looked up. The template receives the context's assigns, the call's assigns
 * and, if the flash has been fetched, the flash messages as "flash". If a
 * layout is active and the format is a layout format, the rendered template is
 * bound to "inner_content" and rendered again using the layout template.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class RenderDispatcher
{
    private static final System.Logger LOG
            = System.getLogger(RenderDispatcher.class.getPackageName());

    /** The assign holding the flash messages. */
    static final String FLASH = "flash";

    /** The layout assign holding the rendered template. */
    static final String INNER_CONTENT = "inner_content";

    private RenderDispatcher() {
        // Empty
    }

    /**
     * Renders and commits.
     *
     * @param ctx context
     * @param template template reference (may be {@code null})
     * @param assigns additional assigns
     *
     * @throws ResponseCommittedException
     *             if the context is already committed
     * @throws FormatNotAcceptedException
     *             if the format is not accepted
     * @throws TemplateNotFoundException
     *             if the template or layout does not exist
     */
    static void render(DefaultContext ctx, String template, Map<String, ?> assigns) {
        ctx.requireUncommitted("render");
        final Config conf = ctx.config();

        final String name;
        final Format format;
        int dot = template == null ? -1 : template.lastIndexOf('.');
        if (template == null) {
            name = ctx.actionName();
            format = ctx.negotiateFormat();
        } else if (dot > 0) {
            name = template.substring(0, dot);
            format = FormatNegotiator.require(
                    template.substring(dot + 1), ctx.acceptedFormats());
        } else {
            name = template;
            format = ctx.negotiateFormat();
        }

        var all = new LinkedHashMap<String, Object>();
        if (ctx.isFlashFetched()) {
            all.put(FLASH, ctx.flash().asMap());
        }
        all.putAll(ctx.assigns());
        all.putAll(assigns);

        final TemplateEngine engine = ctx.controller().templates();
        var key = new TemplateKey(ctx.view(), name, format);
        String body = render(engine, key, all);

        var layout = ctx.layout();
        if (layout.isPresent() && conf.layoutFormats().contains(format)) {
            var lkey = new TemplateKey(conf.layoutNamespace(), layout.get(), format);
            all.put(INNER_CONTENT, body);
            body = render(engine, lkey, all);
        }

        if (ctx.respHeader(CONTENT_TYPE).isEmpty()) {
            ctx.putRespHeader(CONTENT_TYPE, format.mediaType().withCharsetUtf8().toString());
        }
        ResponseFinalizer.commit(ctx, "render", body.getBytes(UTF_8));
    }

    private static String render(TemplateEngine engine, TemplateKey key, Map<String, Object> assigns) {
        LOG.log(DEBUG, () -> "Rendering " + key + ".");
        return engine.render(key, unmodifiableMap(assigns))
                     .orElseThrow(() -> new TemplateNotFoundException(key));
    }
}
