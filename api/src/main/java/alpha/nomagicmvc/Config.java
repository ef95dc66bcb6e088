package alpha.nomagicmvc;

import alpha.nomagicmvc.context.Context;
import alpha.nomagicmvc.render.Format;

import java.util.List;

/**
 * Controller configuration.<p>
 *
 * {@link Config#toBuilder()} allows for any configuration object to be used
 * as a template for a new instance.<p>
 *
 * The static method {@link #configuration()} is a shortcut for
 * {@code Config.}{@link #DEFAULT}{@code .toBuilder()}:
 *
 * <pre>
 *   Controller c = Controller.builder("users")
 *           .config(configuration()
 *                   .acceptedFormats(Format.HTML, Format.JSON)
 *                   .defaultLayout("admin")
 *                   .build())
 *           ...
 *           .build();
 * </pre>
 *
 * The implementation is immutable and inherits the identity-based
 * implementations of {@link Object#hashCode()} and {@link Object#equals(Object)}.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public interface Config
{
    /**
     * The configuration used by a controller, if not set explicitly.<p>
     *
     * This instance contains the following values:<p>
     *
     * Accepted formats = [html]<br>
     * Default format = html<br>
     * Format parameter = "_format"<br>
     * Default layout = "app"<br>
     * Layout namespace = "layouts"<br>
     * Layout formats = [html]<br>
     * Flash session key = "alpha.nomagicmvc.flash"<br>
     * Persist flash on redirect = true
     */
    Config DEFAULT = DefaultConfig.DefaultBuilder.ROOT.build();

    /**
     * Returns the formats a controller accepts, in order of preference.<p>
     *
     * A request may narrow this set using {@link Context#acceptFormats(Format...)}.
     * Any format resolved for rendering must be a member of the accepted set.
     *
     * @return the accepted formats (never empty)
     */
    List<Format> acceptedFormats();

    /**
     * Returns the format used when the request expresses no preference.<p>
     *
     * If the default format is not accepted, the first accepted format is used
     * instead.
     *
     * @return the default format
     */
    Format defaultFormat();

    /**
     * Returns the name of the request parameter that explicitly selects a
     * format, e.g. "/users?_format=json".<p>
     *
     * The parameter takes precedence over the "Accept" header.
     *
     * @return the name of the format parameter
     */
    String formatParameter();

    /**
     * Returns the name of the layout that wraps rendered templates.<p>
     *
     * An empty string means no layout.
     *
     * @return the default layout name (never {@code null})
     */
    String defaultLayout();

    /**
     * {@return the namespace that layout templates are resolved in}
     */
    String layoutNamespace();

    /**
     * Returns the formats for which a layout is applied.<p>
     *
     * Templates of any other format are rendered without a layout.
     *
     * @return the layout formats
     */
    List<Format> layoutFormats();

    /**
     * {@return the session key under which persisted flash messages are stored}
     */
    String flashSessionKey();

    /**
     * Returns whether or not a redirect persists new flash messages.<p>
     *
     * If {@code true}, messages put in the flash before a redirect will be
     * readable by the next request without an explicit call to
     * {@code persist}.
     *
     * @return see JavaDoc
     */
    boolean persistFlashOnRedirect();

    /**
     * Returns a builder with the state of this configuration.
     *
     * @return a builder
     */
    Builder toBuilder();

    /**
     * Returns {@code Config.DEFAULT.toBuilder()}.
     *
     * @return a builder with default values
     */
    static Builder configuration() {
        return DEFAULT.toBuilder();
    }

    /**
     * Builder of a {@link Config}.<p>
     *
     * The builder is immutable. All setters return a new builder instance.
     * Arguments are validated when building.
     */
    interface Builder
    {
        /**
         * Sets a new value.
         *
         * @param newVal new value
         * @return a new builder representing the new state
         * @see Config#acceptedFormats()
         */
        Builder acceptedFormats(Format... newVal);

        /**
         * Sets a new value.
         *
         * @param newVal new value
         * @return a new builder representing the new state
         * @see Config#defaultFormat()
         */
        Builder defaultFormat(Format newVal);

        /**
         * Sets a new value.
         *
         * @param newVal new value
         * @return a new builder representing the new state
         * @see Config#formatParameter()
         */
        Builder formatParameter(String newVal);

        /**
         * Sets a new value.
         *
         * @param newVal new value
         * @return a new builder representing the new state
         * @see Config#defaultLayout()
         */
        Builder defaultLayout(String newVal);

        /**
         * Sets a new value.
         *
         * @param newVal new value
         * @return a new builder representing the new state
         * @see Config#layoutNamespace()
         */
        Builder layoutNamespace(String newVal);

        /**
         * Sets a new value.
         *
         * @param newVal new value
         * @return a new builder representing the new state
         * @see Config#layoutFormats()
         */
        Builder layoutFormats(Format... newVal);

        /**
         * Sets a new value.
         *
         * @param newVal new value
         * @return a new builder representing the new state
         * @see Config#flashSessionKey()
         */
        Builder flashSessionKey(String newVal);

        /**
         * Sets a new value.
         *
         * @param newVal new value
         * @return a new builder representing the new state
         * @see Config#persistFlashOnRedirect()
         */
        Builder persistFlashOnRedirect(boolean newVal);

        /**
         * Builds a configuration object.
         *
         * @return a configuration object
         *
         * @throws NullPointerException
         *             if a value set is {@code null}
         * @throws IllegalArgumentException
         *             if no format is accepted, or
         *             the format parameter, layout namespace or flash session
         *             key is empty
         */
        Config build();
    }
}
