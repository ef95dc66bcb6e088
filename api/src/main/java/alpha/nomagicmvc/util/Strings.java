package alpha.nomagicmvc.util;

import java.util.Locale;
import java.util.function.Consumer;
import java.util.stream.Stream;

import static java.lang.Character.MIN_VALUE;

/**
 * String utilities.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class Strings
{
    private Strings() {
        // Empty
    }
    
    /**
     * Split a string into a returned stream.<p>
     * 
     * Works just as {@code String.split}, except the delimiter has no effect
     * inside an exclusion zone, and no empty substrings are returned.
     * 
     * <pre>
     *   split("a;b", ';', '"')          returns "a", "b"
     *   split("a;\"b;c\"", ';', '"')    returns "a", ""b;c""
     *   split(";;", ';', '"')           returns an empty Stream
     * </pre>
     * 
     * Within an exclusion zone, a backslash escapes the next character.
     * 
     * @param str to split
     * @param delimiter to split by (if not excluded)
     * @param excludeBoundary defines the exclusion zone
     * 
     * @return the substrings
     * 
     * @throws NullPointerException
     *             if {@code str} is {@code null}
     * @throws IllegalArgumentException
     *             if {@code delimiter} is the backslash character, or
     *             if {@code delimiter} and {@code excludeBoundary} are the same
     */
    public static Stream<String> split(
            CharSequence str, char delimiter, char excludeBoundary)
    {
        if (delimiter == '\\') {
            throw new IllegalArgumentException(
                    "Delimiter char can not be the escape char.");
        }
        if (delimiter == excludeBoundary) {
            throw new IllegalArgumentException(
                    "Delimiter char can not be the same as exclude char.");
        }
        var b = Stream.<String>builder();
        split0(str, delimiter, excludeBoundary, b);
        return b.build();
    }
    
    private static void split0(
            CharSequence str, char delimiter, char exclude, Consumer<String> sink)
    {
        StringBuilder tkn = null;
        final int len = str.length();
        char prev = MIN_VALUE;
        boolean excluding = false;
        
        for (int i = 0; i < len; ++i) {
            final char c = str.charAt(i);
            final boolean split;
            if (prev == '\\' && excluding) {
                split = false;
            } else if (c == delimiter) {
                split = !excluding;
            } else {
                if (c == exclude) {
                    excluding = !excluding;
                }
                split = false;
            }
            prev = c;
            if (split) {
                if (tkn != null) {
                    sink.accept(tkn.toString());
                }
                tkn = null;
            } else {
                if (tkn == null) {
                    tkn = new StringBuilder();
                }
                tkn.append(c);
            }
        }
        if (tkn != null) {
            sink.accept(tkn.toString());
        }
    }
    
    /**
     * Unquote a quoted string.<p>
     * 
     * If the string is not surrounded by '"', it is returned as-is. Otherwise
     * the quotes are removed, escape sequences translated and the result
     * stripped.
     * 
     * @param str to unquote
     * @return an unquoted string
     * @throws NullPointerException if {@code str} is {@code null}
     */
    public static String unquote(String str) {
        if (str.length() < 2 || !(str.startsWith("\"") && str.endsWith("\""))) {
            return str;
        }
        return str.substring(1, str.length() - 1)
                  .translateEscapes()
                  .strip();
    }
    
    /**
     * Strip and lower case the given string.
     * 
     * @param str to normalize
     * @return the normalized string
     * @throws NullPointerException if {@code str} is {@code null}
     */
    public static String stripAndLowerCase(String str) {
        return str.strip().toLowerCase(Locale.ROOT);
    }
}
