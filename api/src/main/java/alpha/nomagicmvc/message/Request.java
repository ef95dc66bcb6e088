package alpha.nomagicmvc.message;

import alpha.nomagicmvc.HttpConstants.HeaderName;
import alpha.nomagicmvc.HttpConstants.Method;
import alpha.nomagicmvc.util.Strings;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * An inbound HTTP request, as handed to a controller by the transport.<p>
 *
 * The transport and router are responsible for parsing the request. What a
 * controller receives is the result: a method, the raw path, the merged
 * parameters (path, query and form parameters, in that order of precedence
 * decided by the router) and the request headers.<p>
 *
 * Header names are case-insensitive. The implementation is immutable and
 * thread-safe.
 *
 * <pre>
 *   Request req = Request.builder("GET", "/users/42")
 *                        .param("id", "42")
 *                        .header("Accept", "application/json")
 *                        .build();
 * </pre>
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public interface Request
{
    /**
     * Returns a new builder.
     *
     * @param method request method, e.g. {@link Method#GET}
     * @param path raw request path, e.g. "/users/42"
     *
     * @return a new builder
     *
     * @throws NullPointerException
     *             if any argument is {@code null}
     * @throws IllegalArgumentException
     *             if {@code method} is empty or {@code path} does not start
     *             with a forward slash
     */
    static Builder builder(String method, String path) {
        return DefaultRequest.DefaultBuilder.ROOT.method(method).path(path);
    }

    /**
     * Returns the request method.
     *
     * @return the request method (never {@code null} or empty)
     */
    String method();

    /**
     * Returns the raw request path, without a query.
     *
     * @return the raw request path (never {@code null})
     */
    String path();

    /**
     * Returns all request parameters.
     *
     * @return an unmodifiable map (never {@code null})
     */
    Map<String, String> params();

    /**
     * Returns a request parameter.
     *
     * @param name of parameter
     * @return the value, if present
     * @throws NullPointerException if {@code name} is {@code null}
     */
    default Optional<String> param(String name) {
        return Optional.ofNullable(params().get(name));
    }

    /**
     * Returns all request headers.<p>
     *
     * The returned map orders its keys and looks them up case-insensitively.
     *
     * @return an unmodifiable map (never {@code null})
     */
    Map<String, List<String>> headers();

    /**
     * Returns the first value of a request header.
     *
     * @param name of header (case-insensitive)
     * @return the first value, if present
     * @throws NullPointerException if {@code name} is {@code null}
     */
    default Optional<String> header(String name) {
        var vals = headers().get(name);
        return vals == null || vals.isEmpty() ?
                Optional.empty() : Optional.of(vals.get(0));
    }

    /**
     * Returns the value of a cookie.<p>
     *
     * All "Cookie" header values are searched. A quoted value is unquoted.
     *
     * @param name of cookie (case-sensitive)
     * @return the value, if present
     * @throws NullPointerException if {@code name} is {@code null}
     */
    default Optional<String> cookie(String name) {
        var vals = headers().get(HeaderName.COOKIE);
        if (vals == null) {
            return Optional.empty();
        }
        return vals.stream()
                .flatMap(v -> Strings.split(v, ';', '"'))
                .map(String::strip)
                .filter(pair -> pair.startsWith(name + "="))
                .map(pair -> Strings.unquote(pair.substring(name.length() + 1)))
                .findFirst();
    }

    /**
     * Builder of a {@link Request}.<p>
     *
     * The builder is immutable. All setters return a new builder instance.
     */
    interface Builder
    {
        /**
         * Set the request method.
         *
         * @param method request method
         * @return a new builder
         * @throws NullPointerException if {@code method} is {@code null}
         * @throws IllegalArgumentException if {@code method} is empty
         */
        Builder method(String method);

        /**
         * Set the raw request path.
         *
         * @param path raw request path
         * @return a new builder
         * @throws NullPointerException if {@code path} is {@code null}
         * @throws IllegalArgumentException if {@code path} does not start with '/'
         */
        Builder path(String path);

        /**
         * Set a request parameter, replacing any previous value.
         *
         * @param name of parameter
         * @param value of parameter
         * @return a new builder
         * @throws NullPointerException if any argument is {@code null}
         */
        Builder param(String name, String value);

        /**
         * Add a request header value.
         *
         * @param name of header
         * @param value of header
         * @return a new builder
         * @throws NullPointerException if any argument is {@code null}
         */
        Builder header(String name, String value);

        /**
         * Returns a new request.
         *
         * @return a new request
         */
        Request build();
    }
}
