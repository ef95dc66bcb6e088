package alpha.nomagicmvc.message;

import alpha.nomagicmvc.HttpConstants.ReasonPhrase;
import alpha.nomagicmvc.HttpConstants.StatusCode;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * A committed HTTP response, returned to the transport.<p>
 *
 * A {@code Response} is what a controller produces once per request. It is
 * immutable and thread-safe, but modifications of any response are possible
 * through {@link #toBuilder()}:
 *
 * <pre>
 *   Response withHeader = Responses.ok()
 *                                  .toBuilder()
 *                                  .header("Cache-Control", "no-store")
 *                                  .build();
 * </pre>
 *
 * Header names are case-insensitive. The reason phrase defaults to the one
 * registered for the status code, or "Unknown".
 *
 * @see Responses
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public interface Response
{
    /**
     * Returns a builder already populated with the given status code.
     *
     * @param statusCode of response
     * @return a builder
     */
    static Builder builder(int statusCode) {
        return DefaultResponse.DefaultBuilder.ROOT.statusCode(statusCode);
    }

    /**
     * {@return the status code}
     */
    int statusCode();

    /**
     * {@return the reason phrase}
     */
    String reasonPhrase();

    /**
     * Returns all response headers.<p>
     *
     * The returned map looks up its keys case-insensitively.
     *
     * @return an unmodifiable map (never {@code null})
     */
    Map<String, List<String>> headers();

    /**
     * Returns the first value of a response header.
     *
     * @param name of header (case-insensitive)
     * @return the first value, if present
     */
    default Optional<String> header(String name) {
        var vals = headers().get(name);
        return vals == null || vals.isEmpty() ?
                Optional.empty() : Optional.of(vals.get(0));
    }

    /**
     * Returns the body.<p>
     *
     * The returned array is a copy.
     *
     * @return the body (never {@code null}, may be empty)
     */
    byte[] body();

    /**
     * {@return the body decoded using UTF-8}
     */
    default String bodyAsString() {
        return new String(body(), UTF_8);
    }

    /**
     * {@return {@code true} if the status code is 3XX (Redirection)}
     */
    default boolean isRedirection() {
        return StatusCode.isRedirection(statusCode());
    }

    /**
     * Returns a builder populated with the state of this response.
     *
     * @return a builder
     */
    Builder toBuilder();

    /**
     * Builder of a {@link Response}.<p>
     *
     * The builder is immutable. All setters return a new builder instance.
     */
    interface Builder
    {
        /**
         * Set the status code.<p>
         *
         * The reason phrase is reset to the default of the new status code
         * unless set explicitly afterwards.
         *
         * @param statusCode of response
         * @return a new builder
         */
        Builder statusCode(int statusCode);

        /**
         * Set the reason phrase.
         *
         * @param reasonPhrase of response
         * @return a new builder
         * @throws NullPointerException if {@code reasonPhrase} is {@code null}
         * @see ReasonPhrase
         */
        Builder reasonPhrase(String reasonPhrase);

        /**
         * Set a header, replacing all previous values of the header.
         *
         * @param name of header
         * @param value of header
         * @return a new builder
         * @throws NullPointerException if any argument is {@code null}
         * @throws IllegalArgumentException if {@code name} is empty
         */
        Builder header(String name, String value);

        /**
         * Add a header value.
         *
         * @param name of header
         * @param value of header
         * @return a new builder
         * @throws NullPointerException if any argument is {@code null}
         * @throws IllegalArgumentException if {@code name} is empty
         */
        Builder addHeader(String name, String value);

        /**
         * Remove all values of a header.
         *
         * @param name of header
         * @return a new builder
         */
        Builder removeHeader(String name);

        /**
         * Set the body.
         *
         * @param body of response
         * @return a new builder
         * @throws NullPointerException if {@code body} is {@code null}
         */
        Builder body(byte[] body);

        /**
         * Returns a new response.
         *
         * @return a new response
         * @throws IllegalStateException
         *             if a 204 (No Content) or 304 (Not Modified) response
         *             has a body
         */
        Response build();
    }
}
