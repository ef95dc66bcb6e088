package alpha.nomagicmvc.render;

import java.util.Map;
import java.util.Optional;

/**
 * Renders templates into text.<p>
 *
 * The templating language is not of concern to the controller layer. An
 * engine is plugged into a controller through
 * {@code Controller.Builder.templates(TemplateEngine)}.<p>
 *
 * The implementation must be thread-safe.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
@FunctionalInterface
public interface TemplateEngine
{
    /**
     * Render a template.<p>
     *
     * An empty optional means that the template does not exist, which the
     * caller translates to a {@link TemplateNotFoundException}.
     *
     * @param key of template
     * @param assigns template variables (unmodifiable)
     *
     * @return the rendered text, or empty if there is no such template
     */
    Optional<String> render(TemplateKey key, Map<String, Object> assigns);
}
