package alpha.nomagicmvc.render;

import static java.util.Objects.requireNonNull;

/**
 * The key a template is resolved by.<p>
 *
 * A key is printed as {@code namespace/name.format}, for example
 * "users/show.html" or "layouts/app.html".
 *
 * @param namespace of template, usually the controller namespace
 * @param name of template, usually the action name
 * @param format of template
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public record TemplateKey(String namespace, String name, Format format)
{
    /**
     * Initializes this object.
     *
     * @throws NullPointerException
     *             if any argument is {@code null}
     * @throws IllegalArgumentException
     *             if {@code namespace} or {@code name} is empty
     */
    public TemplateKey {
        requireNonNull(format, "format");
        if (requireNonNull(namespace, "namespace").isEmpty() ||
            requireNonNull(name, "name").isEmpty()) {
            throw new IllegalArgumentException("Empty namespace or name.");
        }
    }

    @Override
    public String toString() {
        return namespace + '/' + name + '.' + format.name();
    }
}
