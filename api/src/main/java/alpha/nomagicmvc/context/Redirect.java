package alpha.nomagicmvc.context;

import java.net.URI;
import java.net.URISyntaxException;

import static java.util.Objects.requireNonNull;

/**
 * A redirect destination.<p>
 *
 * Whether the destination is internal or external is stated explicitly by the
 * factory used, and each factory rejects a destination of the other kind:
 *
 * <pre>
 *   Redirect.to("/users/42");                   // OK
 *   Redirect.to("https://example.com/");        // IllegalRedirectException
 *   Redirect.to("//example.com/");              // IllegalRedirectException
 *   Redirect.external("https://example.com/");  // OK
 *   Redirect.external("/users/42");             // IllegalRedirectException
 * </pre>
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 * @see Context#redirect(Redirect)
 */
public final class Redirect
{
    /**
     * Returns an internal redirect.
     *
     * @param path raw path, optionally with a query, e.g. "/users?page=2"
     *
     * @return a redirect
     *
     * @throws NullPointerException
     *             if {@code path} is {@code null}
     * @throws IllegalRedirectException
     *             if {@code path} is a full or protocol-relative URL, or
     *             does not start with a forward slash, or
     *             is not a valid URI reference
     */
    public static Redirect to(String path) {
        URI uri = parse(path);
        if (uri.isAbsolute() || path.startsWith("//") || uri.getRawAuthority() != null) {
            throw new IllegalRedirectException(
                    "Expected a path, got a URL (use Redirect.external): " + path);
        }
        if (!path.startsWith("/")) {
            throw new IllegalRedirectException(
                    "Path must start with a forward slash: " + path);
        }
        return new Redirect(path, false);
    }

    /**
     * Returns an external redirect.
     *
     * @param url absolute URL, e.g. "https://example.com/"
     *
     * @return a redirect
     *
     * @throws NullPointerException
     *             if {@code url} is {@code null}
     * @throws IllegalRedirectException
     *             if {@code url} is not an absolute URL with a host
     */
    public static Redirect external(String url) {
        URI uri = parse(url);
        if (!uri.isAbsolute() || uri.getHost() == null) {
            throw new IllegalRedirectException(
                    "Expected an absolute URL (use Redirect.to for paths): " + url);
        }
        return new Redirect(url, true);
    }

    private static URI parse(String location) {
        requireNonNull(location, "location");
        if (location.isEmpty()) {
            throw new IllegalRedirectException("Empty redirect location.");
        }
        try {
            return new URI(location);
        } catch (URISyntaxException e) {
            throw new IllegalRedirectException("Invalid redirect location: " + location, e);
        }
    }

    private final String location;
    private final boolean external;

    private Redirect(String location, boolean external) {
        this.location = location;
        this.external = external;
    }

    /**
     * {@return the value of the "Location" header}
     */
    public String location() {
        return location;
    }

    /**
     * {@return {@code true} if this redirect leaves the application}
     */
    public boolean isExternal() {
        return external;
    }

    @Override
    public String toString() {
        return (external ? "external:" : "to:") + location;
    }
}
