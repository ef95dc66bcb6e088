package alpha.nomagicmvc.message;

import alpha.nomagicmvc.HttpConstants;
import alpha.nomagicmvc.render.Format;
import alpha.nomagicmvc.util.Strings;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;

import static alpha.nomagicmvc.util.Strings.stripAndLowerCase;
import static java.lang.Double.parseDouble;
import static java.lang.System.Logger.Level.DEBUG;
import static java.util.Collections.unmodifiableMap;

/**
 * A media type is an identifier for the representation of content being
 * transmitted.<p>
 *
 * Every {@link Format} is bound to one media type, which is the value used in
 * the "Content-Type" header of a rendered response. Media types, and the
 * specialized {@link MediaRange}, are also what the client specifies in an
 * "Accept" header to drive content negotiation.<p>
 *
 * {@code MediaType} is an immutable value-based class. Type, subtype and
 * parameter names are case-insensitive and lower cased by the parser. The order
 * of parameters is not relevant for equality, nor is the quality of a media
 * range.
 *
 * @see HttpConstants.HeaderName#CONTENT_TYPE
 * @see HttpConstants.HeaderName#ACCEPT
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public class MediaType
{
    private static final System.Logger LOG
            = System.getLogger(MediaType.class.getPackageName());

    private static final String WILDCARD = "*";
    private static final String q = "q";

    /** Any type. Value: "*&#47;*". */
    public static final MediaType ALL = parse("*/*");

    /** Text. Value: "text/plain". */
    public static final MediaType TEXT_PLAIN = parse("text/plain");

    /** HyperText Markup Language. Value: "text/html". */
    public static final MediaType TEXT_HTML = parse("text/html");

    /** JSON. Value: "application/json". */
    public static final MediaType APPLICATION_JSON = parse("application/json");

    /** XML. Value: "application/xml". */
    public static final MediaType APPLICATION_XML = parse("application/xml");

    /**
     * Parse a text into a {@link MediaType} or a {@link MediaRange}.<p>
     *
     * If the type or subtype is a wildcard, or a "q" parameter is present, then
     * the returned type is a {@code MediaRange}.<p>
     *
     * Parameters following the "q" parameter are media range extension
     * parameters. They are logged and ignored.<p>
     *
     * Quoted parameter values are unquoted. The value of the "charset"
     * parameter of "text/*" types is lower cased. As an example, all these are
     * considered equal:
     * <pre>
     *   text/html;charset=utf-8
     *   text/html;charset=UTF-8
     *   Text/HTML;Charset="utf-8"
     *   text/html; charset="utf-8"
     * </pre>
     *
     * @param text to parse
     *
     * @return a parsed media type (never {@code null})
     *
     * @throws NullPointerException
     *             if {@code text} is {@code null}
     * @throws MediaTypeParseException
     *             if there's not exactly one forward slash in "type/subtype", or
     *             type or subtype is empty, or
     *             there's a wildcard type but not a wildcard subtype, or
     *             a parameter name or value is empty, or
     *             a parameter has been specified more than once, or
     *             the q-parameter can not be parsed to a double
     */
    public static MediaType parse(final String text) {
        final String[] tokens = Strings.split(text, ';', '"').toArray(String[]::new);
        if (tokens.length == 0) {
            throw new MediaTypeParseException(text, "Empty.");
        }
        final String[] types = parseTypes(tokens[0], text);
        final String type = types[0],
                  subtype = types[1];

        Map<String, String> params = parseParams(type, tokens, 1, true, text);
        final int size = params.size();

        String qStr = params.remove(q);
        OptionalDouble qVal = OptionalDouble.empty();
        if (qStr != null) {
            try {
                qVal = OptionalDouble.of(parseDouble(qStr));
            } catch (NumberFormatException e) {
                throw new MediaTypeParseException(text,
                        "Non-parsable value for " + q + "-parameter.", e);
            }
        }

        Map<String, String> ext = parseParams(type, tokens, 1 + size, false, text);
        if (!ext.isEmpty()) {
            LOG.log(DEBUG, () -> "Media range extension parameters ignored: " + ext);
        }

        return type.equals(WILDCARD) || subtype.equals(WILDCARD) || qVal.isPresent() ?
                new MediaRange(text, type, subtype, params, qVal.orElse(1)) :
                new MediaType(text, type, subtype, params);
    }

    private static String[] parseTypes(String tkn, String txt) {
        final String[] raw = tkn.split("/");
        unacceptable(raw.length != 2, txt,
            "Expected exactly one forward slash in <type/subtype>.");

        final String type = stripAndLowerCase(raw[0]);
        unacceptable(type.isEmpty(), txt, "Type is empty.");

        final String subtype = stripAndLowerCase(raw[1]);
        unacceptable(subtype.isEmpty(), txt, "Subtype is empty.");

        unacceptable(type.equals(WILDCARD) && !subtype.equals(WILDCARD), txt,
            "Wildcard type but not a wildcard subtype.");

        return new String[]{ type, subtype };
    }

    private static Map<String, String> parseParams(
            String type, String[] tokens, int offset, boolean stopAfterQ, String txt)
    {
        Map<String, String> params = new LinkedHashMap<>();
        for (int i = offset; i < tokens.length; ++i) {
            String[] nameAndValue = parseParam(type, tokens[i], txt);
            var old = params.put(nameAndValue[0], nameAndValue[1]);
            // RFC 6838 §4.3
            unacceptable(old != null, txt, "Duplicated parameters.");
            if (stopAfterQ && nameAndValue[0].equals(q)) {
                break;
            }
        }
        return params;
    }

    private static String[] parseParam(String type, String tkn, String txt) {
        int eq = tkn.indexOf('=');
        unacceptable(eq == -1, txt, "A parameter has no assigned value.");

        String name = stripAndLowerCase(tkn.substring(0, eq));
        unacceptable(name.isEmpty(), txt, "Empty parameter name.");

        String value = Strings.unquote(tkn.substring(eq + 1).strip());
        unacceptable(value.isEmpty(), txt, "Empty parameter value.");

        if (type.equals("text") && name.equals("charset")) {
            value = value.toLowerCase(Locale.ROOT);
        }
        return new String[]{ name, value };
    }

    private static void unacceptable(boolean whatIs, String parseText, String appendMsg) {
        if (whatIs) {
            throw new MediaTypeParseException(parseText, appendMsg);
        }
    }

    private final String text, type, subtype;
    private final Map<String, String> params;

    MediaType(String text, String type, String subtype, Map<String, String> params) {
        this.text    = text;
        this.type    = type;
        this.subtype = subtype;
        this.params  = unmodifiableMap(params);
    }

    /**
     * Returns the media type.<p>
     *
     * For example, "text/plain; charset=utf-8" returns "text".
     *
     * @return the media type (not {@code null})
     */
    public final String type() {
        return type;
    }

    /**
     * Returns the media subtype.<p>
     *
     * For example, "text/plain; charset=utf-8" returns "plain".
     *
     * @return the media subtype (not {@code null})
     */
    public final String subtype() {
        return subtype;
    }

    /**
     * Returns all media parameters, excluding the "q" parameter of a media
     * range.
     *
     * @return an unmodifiable map (not {@code null})
     */
    public final Map<String, String> parameters() {
        return params;
    }

    /**
     * Returns this media type with the "charset" parameter set to "utf-8".<p>
     *
     * The returned type is what a rendered response uses as its
     * "Content-Type".
     *
     * @return this media type with a UTF-8 charset
     */
    public final MediaType withCharsetUtf8() {
        if ("utf-8".equalsIgnoreCase(params.get("charset"))) {
            return this;
        }
        Map<String, String> p = new LinkedHashMap<>(params);
        p.put("charset", "utf-8");
        StringBuilder b = new StringBuilder(type).append('/').append(subtype);
        p.forEach((k, v) -> b.append("; ").append(k).append('=').append(v));
        return new MediaType(b.toString(), type, subtype, p);
    }

    /**
     * Returns an integer value for specificity.<p>
     *
     * The returned value is greatest for the least specific media type and
     * lowest for the most specific media type:<p>
     *
     * 5 = type and subtype is wildcard, no parameters.<br>
     * 4 = type and subtype is wildcard, has parameters.<br>
     * 3 = subtype is wildcard, no parameters.<br>
     * 2 = subtype is wildcard, has parameters.<br>
     * 1 = no wildcard, no parameters.<br>
     * 0 = no wildcard, has parameters.
     *
     * @return an integer value for specificity
     */
    public final int specificity() {
        final boolean wildType = type.equals(WILDCARD),
                      wildSub  = subtype.equals(WILDCARD),
                      noParams = params.isEmpty();

        return wildType ?  noParams ? 5 : 4 :
               wildSub  ?  noParams ? 3 : 2 :
            /* specific */ noParams ? 1 : 0 ;
    }

    /**
     * Returns {@code true} if this media type or range includes the given
     * media type.<p>
     *
     * Wildcards of this type match anything. Parameters of this type, if any,
     * must all be present with equal values in the other type. The quality of
     * a media range is not considered.
     *
     * <pre>
     *   "text/*" includes "text/html"                     true
     *   "text/html" includes "text/html; charset=utf-8"   true
     *   "text/html; charset=utf-8" includes "text/html"   false
     *   "text/html" includes "text/plain"                 false
     * </pre>
     *
     * @param other media type
     * @return see JavaDoc
     * @throws NullPointerException if {@code other} is {@code null}
     */
    public final boolean includes(MediaType other) {
        if (!type.equals(WILDCARD) && !type.equals(other.type)) {
            return false;
        }
        if (!subtype.equals(WILDCARD) && !subtype.equals(other.subtype)) {
            return false;
        }
        return other.params.entrySet().containsAll(params.entrySet());
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, subtype, params);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof MediaType other)) {
            return false;
        }
        return this.type.equals(other.type) &&
               this.subtype.equals(other.subtype) &&
               this.params.equals(other.params);
    }

    /**
     * Returns the same string instance used when this media type was parsed.
     *
     * @return the same string instance used when this media type was parsed
     */
    @Override
    public String toString() {
        return text;
    }
}
