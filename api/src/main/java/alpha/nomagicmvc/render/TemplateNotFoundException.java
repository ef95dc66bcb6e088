package alpha.nomagicmvc.render;

import java.io.Serial;

import static java.util.Objects.requireNonNull;

/**
 * Thrown when a template could not be resolved.<p>
 *
 * The default exception handler translates this exception to a 500 (Internal
 * Server Error) response.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class TemplateNotFoundException extends RuntimeException
{
    @Serial
    private static final long serialVersionUID = 1L;

    private final transient TemplateKey key;

    /**
     * Initializes this object.
     *
     * @param key of the missing template
     */
    public TemplateNotFoundException(TemplateKey key) {
        super("Template not found: " + requireNonNull(key));
        this.key = key;
    }

    /**
     * {@return the key of the missing template}
     */
    public TemplateKey key() {
        return key;
    }
}
