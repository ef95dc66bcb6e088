package alpha.nomagicmvc.testutil;

import alpha.nomagicmvc.render.TemplateEngine;
import alpha.nomagicmvc.render.TemplateKey;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static java.util.Collections.unmodifiableMap;
import static java.util.Objects.requireNonNull;

/**
 * A map-backed template engine.<p>
 *
 * Templates are registered by their printed key, e.g. "users/index.html".
 * The only syntax supported is {@code {{name}}}, which is replaced with
 * {@code String.valueOf} of the assign. An assign that is missing renders as
 * an empty string.<p>
 *
 * <pre>
 *   var templates = new TestTemplates()
 *           .add("users/index.html", "&lt;p&gt;{{count}} users&lt;/p&gt;")
 *           .add("layouts/app.html", "&lt;body&gt;{{inner_content}}&lt;/body&gt;");
 * </pre>
 *
 * The engine records every key it was asked to render, found or not. Not
 * thread-safe.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class TestTemplates implements TemplateEngine
{
    private static final Pattern VAR = Pattern.compile("\\{\\{\\s*([\\w.]+)\\s*}}");

    private final Map<String, String> templates = new HashMap<>();
    private final List<String> requested = new ArrayList<>();
    private final List<Map<String, Object>> assigns = new ArrayList<>();

    /**
     * Registers a template.
     *
     * @param key printed template key, e.g. "users/index.html"
     * @param source of template
     * @return this for chaining/fluency
     */
    public TestTemplates add(String key, String source) {
        templates.put(requireNonNull(key), requireNonNull(source));
        return this;
    }

    @Override
    public Optional<String> render(TemplateKey key, Map<String, Object> assigns) {
        requested.add(key.toString());
        this.assigns.add(unmodifiableMap(new HashMap<>(assigns)));
        var src = templates.get(key.toString());
        if (src == null) {
            return Optional.empty();
        }
        Matcher m = VAR.matcher(src);
        var b = new StringBuilder();
        while (m.find()) {
            var v = assigns.get(m.group(1));
            m.appendReplacement(b, Matcher.quoteReplacement(v == null ? "" : String.valueOf(v)));
        }
        m.appendTail(b);
        return Optional.of(b.toString());
    }

    /**
     * {@return all printed keys requested, in order}
     */
    public List<String> requested() {
        return List.copyOf(requested);
    }

    /**
     * Returns the assigns given to the last render call.
     *
     * @return the assigns
     * @throws IllegalStateException if nothing was rendered
     */
    public Map<String, Object> lastAssigns() {
        if (assigns.isEmpty()) {
            throw new IllegalStateException("Nothing rendered.");
        }
        return assigns.get(assigns.size() - 1);
    }
}
