package alpha.nomagicmvc.render;

import alpha.nomagicmvc.message.MediaType;

import java.util.regex.Pattern;

import static java.util.Objects.requireNonNull;

/**
 * A response format, such as "html" or "json".<p>
 *
 * A format has a short name and a media type. The name is used in template
 * names ({@code "show.json"}), in the format request parameter
 * ({@code ?_format=json}) and in {@link alpha.nomagicmvc.Config#acceptedFormats()}.
 * The media type is matched against the "Accept" header during content
 * negotiation and becomes the "Content-Type" of the rendered response.<p>
 *
 * Two formats are equal if they have the same name.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class Format
{
    private static final Pattern NAME = Pattern.compile("[a-z0-9][a-z0-9_+\\-]*");

    /** HyperText Markup Language. */
    public static final Format HTML = new Format("html", MediaType.TEXT_HTML);

    /** JSON. */
    public static final Format JSON = new Format("json", MediaType.APPLICATION_JSON);

    /** Plain text. */
    public static final Format TEXT = new Format("text", MediaType.TEXT_PLAIN);

    /** XML. */
    public static final Format XML = new Format("xml", MediaType.APPLICATION_XML);

    /**
     * Returns a format.<p>
     *
     * If the name and media type equals that of a built-in format, the
     * built-in constant is returned.
     *
     * @param name of format, e.g. "csv"
     * @param mediaType of format, e.g. "text/csv"
     *
     * @return a format
     *
     * @throws NullPointerException
     *             if any argument is {@code null}
     * @throws IllegalArgumentException
     *             if {@code name} is not lower case alphanumeric (and '_', '+', '-')
     */
    public static Format of(String name, MediaType mediaType) {
        requireNonNull(mediaType, "mediaType");
        for (Format f : new Format[]{ HTML, JSON, TEXT, XML }) {
            if (f.name.equals(name) && f.mediaType.equals(mediaType)) {
                return f;
            }
        }
        return new Format(name, mediaType);
    }

    private final String name;
    private final MediaType mediaType;

    private Format(String name, MediaType mediaType) {
        if (!NAME.matcher(requireNonNull(name, "name")).matches()) {
            throw new IllegalArgumentException("Illegal format name: \"" + name + "\"");
        }
        this.name = name;
        this.mediaType = mediaType;
    }

    /**
     * {@return the name of this format}
     */
    public String name() {
        return name;
    }

    /**
     * {@return the media type of this format}
     */
    public MediaType mediaType() {
        return mediaType;
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        return this == obj ||
               obj instanceof Format other && name.equals(other.name);
    }

    @Override
    public String toString() {
        return name;
    }
}
