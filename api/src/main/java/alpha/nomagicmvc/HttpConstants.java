package alpha.nomagicmvc;

import alpha.nomagicmvc.context.Context;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Namespace of constants related to the HTTP protocol.<p>
 *
 * The status code table in this class is the table of <i>recognized</i> status
 * codes. A response is only committed with a status code found in this table,
 * see {@link Context#putStatus(int)}.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class HttpConstants {
    private HttpConstants() {
        // Empty
    }

    /**
     * Request methods.
     *
     * @see <a href="https://tools.ietf.org/html/rfc7231#section-4">RFC 7231 §4</a>
     */
    public static final class Method {
        private Method() {
            // Empty
        }

        /** Retrieve a resource. */
        public static final String GET = "GET";
        /** Same as GET, minus the response body. */
        public static final String HEAD = "HEAD";
        /** Submit data to a processor. */
        public static final String POST = "POST";
        /** Create or replace a known resource. */
        public static final String PUT = "PUT";
        /** Partially update a known resource. */
        public static final String PATCH = "PATCH";
        /** Remove a resource. */
        public static final String DELETE = "DELETE";
        /** Describe communication options. */
        public static final String OPTIONS = "OPTIONS";
    }

    /**
     * Status codes recognized by the library.<p>
     *
     * Each code is also addressable by a symbolic name, which is the reason
     * phrase lower cased and with all non-alphanumeric runs replaced by an
     * underscore (apostrophes are dropped). For example:
     *
     * <pre>
     *   200  ok
     *   302  found
     *   404  not_found
     *   418  im_a_teapot
     *   422  unprocessable_entity
     * </pre>
     *
     * @see Context#putStatus(String)
     */
    public static final class StatusCode {
        private StatusCode() {
            // Empty
        }

        /** Continue. */
        public static final int ONE_HUNDRED = 100;
        /** Switching Protocols. */
        public static final int ONE_HUNDRED_ONE = 101;
        /** Processing. */
        public static final int ONE_HUNDRED_TWO = 102;
        /** Early Hints. */
        public static final int ONE_HUNDRED_THREE = 103;
        /** OK. */
        public static final int TWO_HUNDRED = 200;
        /** Created. */
        public static final int TWO_HUNDRED_ONE = 201;
        /** Accepted. */
        public static final int TWO_HUNDRED_TWO = 202;
        /** Non-Authoritative Information. */
        public static final int TWO_HUNDRED_THREE = 203;
        /** No Content. */
        public static final int TWO_HUNDRED_FOUR = 204;
        /** Reset Content. */
        public static final int TWO_HUNDRED_FIVE = 205;
        /** Partial Content. */
        public static final int TWO_HUNDRED_SIX = 206;
        /** Multi-Status. */
        public static final int TWO_HUNDRED_SEVEN = 207;
        /** Already Reported. */
        public static final int TWO_HUNDRED_EIGHT = 208;
        /** IM Used. */
        public static final int TWO_HUNDRED_TWENTY_SIX = 226;
        /** Multiple Choices. */
        public static final int THREE_HUNDRED = 300;
        /** Moved Permanently. */
        public static final int THREE_HUNDRED_ONE = 301;
        /** Found. The default status of a redirect. */
        public static final int THREE_HUNDRED_TWO = 302;
        /** See Other. */
        public static final int THREE_HUNDRED_THREE = 303;
        /** Not Modified. */
        public static final int THREE_HUNDRED_FOUR = 304;
        /** Use Proxy. */
        public static final int THREE_HUNDRED_FIVE = 305;
        /** Temporary Redirect. */
        public static final int THREE_HUNDRED_SEVEN = 307;
        /** Permanent Redirect. */
        public static final int THREE_HUNDRED_EIGHT = 308;
        /** Bad Request. */
        public static final int FOUR_HUNDRED = 400;
        /** Unauthorized. */
        public static final int FOUR_HUNDRED_ONE = 401;
        /** Payment Required. */
        public static final int FOUR_HUNDRED_TWO = 402;
        /** Forbidden. */
        public static final int FOUR_HUNDRED_THREE = 403;
        /** Not Found. */
        public static final int FOUR_HUNDRED_FOUR = 404;
        /** Method Not Allowed. */
        public static final int FOUR_HUNDRED_FIVE = 405;
        /** Not Acceptable. Failed content negotiation. */
        public static final int FOUR_HUNDRED_SIX = 406;
        /** Proxy Authentication Required. */
        public static final int FOUR_HUNDRED_SEVEN = 407;
        /** Request Timeout. */
        public static final int FOUR_HUNDRED_EIGHT = 408;
        /** Conflict. */
        public static final int FOUR_HUNDRED_NINE = 409;
        /** Gone. */
        public static final int FOUR_HUNDRED_TEN = 410;
        /** Length Required. */
        public static final int FOUR_HUNDRED_ELEVEN = 411;
        /** Precondition Failed. */
        public static final int FOUR_HUNDRED_TWELVE = 412;
        /** Payload Too Large. */
        public static final int FOUR_HUNDRED_THIRTEEN = 413;
        /** URI Too Long. */
        public static final int FOUR_HUNDRED_FOURTEEN = 414;
        /** Unsupported Media Type. */
        public static final int FOUR_HUNDRED_FIFTEEN = 415;
        /** Range Not Satisfiable. */
        public static final int FOUR_HUNDRED_SIXTEEN = 416;
        /** Expectation Failed. */
        public static final int FOUR_HUNDRED_SEVENTEEN = 417;
        /** I'm a Teapot. */
        public static final int FOUR_HUNDRED_EIGHTEEN = 418;
        /** Misdirected Request. */
        public static final int FOUR_HUNDRED_TWENTY_ONE = 421;
        /** Unprocessable Entity. */
        public static final int FOUR_HUNDRED_TWENTY_TWO = 422;
        /** Locked. */
        public static final int FOUR_HUNDRED_TWENTY_THREE = 423;
        /** Failed Dependency. */
        public static final int FOUR_HUNDRED_TWENTY_FOUR = 424;
        /** Too Early. */
        public static final int FOUR_HUNDRED_TWENTY_FIVE = 425;
        /** Upgrade Required. */
        public static final int FOUR_HUNDRED_TWENTY_SIX = 426;
        /** Precondition Required. */
        public static final int FOUR_HUNDRED_TWENTY_EIGHT = 428;
        /** Too Many Requests. */
        public static final int FOUR_HUNDRED_TWENTY_NINE = 429;
        /** Request Header Fields Too Large. */
        public static final int FOUR_HUNDRED_THIRTY_ONE = 431;
        /** Unavailable For Legal Reasons. */
        public static final int FOUR_HUNDRED_FIFTY_ONE = 451;
        /** Internal Server Error. */
        public static final int FIVE_HUNDRED = 500;
        /** Not Implemented. */
        public static final int FIVE_HUNDRED_ONE = 501;
        /** Bad Gateway. */
        public static final int FIVE_HUNDRED_TWO = 502;
        /** Service Unavailable. */
        public static final int FIVE_HUNDRED_THREE = 503;
        /** Gateway Timeout. */
        public static final int FIVE_HUNDRED_FOUR = 504;
        /** HTTP Version Not Supported. */
        public static final int FIVE_HUNDRED_FIVE = 505;
        /** Variant Also Negotiates. */
        public static final int FIVE_HUNDRED_SIX = 506;
        /** Insufficient Storage. */
        public static final int FIVE_HUNDRED_SEVEN = 507;
        /** Loop Detected. */
        public static final int FIVE_HUNDRED_EIGHT = 508;
        /** Not Extended. */
        public static final int FIVE_HUNDRED_TEN = 510;
        /** Network Authentication Required. */
        public static final int FIVE_HUNDRED_ELEVEN = 511;

        private static final Map<Integer, String> PHRASES = buildPhrases();
        private static final Map<String, Integer> NAMES = buildNames();

        private static Map<Integer, String> buildPhrases() {
            Map<Integer, String> m = new LinkedHashMap<>();
            m.put(ONE_HUNDRED, ReasonPhrase.CONTINUE);
            m.put(ONE_HUNDRED_ONE, ReasonPhrase.SWITCHING_PROTOCOLS);
            m.put(ONE_HUNDRED_TWO, ReasonPhrase.PROCESSING);
            m.put(ONE_HUNDRED_THREE, ReasonPhrase.EARLY_HINTS);
            m.put(TWO_HUNDRED, ReasonPhrase.OK);
            m.put(TWO_HUNDRED_ONE, ReasonPhrase.CREATED);
            m.put(TWO_HUNDRED_TWO, ReasonPhrase.ACCEPTED);
            m.put(TWO_HUNDRED_THREE, ReasonPhrase.NON_AUTHORITATIVE_INFORMATION);
            m.put(TWO_HUNDRED_FOUR, ReasonPhrase.NO_CONTENT);
            m.put(TWO_HUNDRED_FIVE, ReasonPhrase.RESET_CONTENT);
            m.put(TWO_HUNDRED_SIX, ReasonPhrase.PARTIAL_CONTENT);
            m.put(TWO_HUNDRED_SEVEN, ReasonPhrase.MULTI_STATUS);
            m.put(TWO_HUNDRED_EIGHT, ReasonPhrase.ALREADY_REPORTED);
            m.put(TWO_HUNDRED_TWENTY_SIX, ReasonPhrase.IM_USED);
            m.put(THREE_HUNDRED, ReasonPhrase.MULTIPLE_CHOICES);
            m.put(THREE_HUNDRED_ONE, ReasonPhrase.MOVED_PERMANENTLY);
            m.put(THREE_HUNDRED_TWO, ReasonPhrase.FOUND);
            m.put(THREE_HUNDRED_THREE, ReasonPhrase.SEE_OTHER);
            m.put(THREE_HUNDRED_FOUR, ReasonPhrase.NOT_MODIFIED);
            m.put(THREE_HUNDRED_FIVE, ReasonPhrase.USE_PROXY);
            m.put(THREE_HUNDRED_SEVEN, ReasonPhrase.TEMPORARY_REDIRECT);
            m.put(THREE_HUNDRED_EIGHT, ReasonPhrase.PERMANENT_REDIRECT);
            m.put(FOUR_HUNDRED, ReasonPhrase.BAD_REQUEST);
            m.put(FOUR_HUNDRED_ONE, ReasonPhrase.UNAUTHORIZED);
            m.put(FOUR_HUNDRED_TWO, ReasonPhrase.PAYMENT_REQUIRED);
            m.put(FOUR_HUNDRED_THREE, ReasonPhrase.FORBIDDEN);
            m.put(FOUR_HUNDRED_FOUR, ReasonPhrase.NOT_FOUND);
            m.put(FOUR_HUNDRED_FIVE, ReasonPhrase.METHOD_NOT_ALLOWED);
            m.put(FOUR_HUNDRED_SIX, ReasonPhrase.NOT_ACCEPTABLE);
            m.put(FOUR_HUNDRED_SEVEN, ReasonPhrase.PROXY_AUTHENTICATION_REQUIRED);
            m.put(FOUR_HUNDRED_EIGHT, ReasonPhrase.REQUEST_TIMEOUT);
            m.put(FOUR_HUNDRED_NINE, ReasonPhrase.CONFLICT);
            m.put(FOUR_HUNDRED_TEN, ReasonPhrase.GONE);
            m.put(FOUR_HUNDRED_ELEVEN, ReasonPhrase.LENGTH_REQUIRED);
            m.put(FOUR_HUNDRED_TWELVE, ReasonPhrase.PRECONDITION_FAILED);
            m.put(FOUR_HUNDRED_THIRTEEN, ReasonPhrase.PAYLOAD_TOO_LARGE);
            m.put(FOUR_HUNDRED_FOURTEEN, ReasonPhrase.URI_TOO_LONG);
            m.put(FOUR_HUNDRED_FIFTEEN, ReasonPhrase.UNSUPPORTED_MEDIA_TYPE);
            m.put(FOUR_HUNDRED_SIXTEEN, ReasonPhrase.RANGE_NOT_SATISFIABLE);
            m.put(FOUR_HUNDRED_SEVENTEEN, ReasonPhrase.EXPECTATION_FAILED);
            m.put(FOUR_HUNDRED_EIGHTEEN, ReasonPhrase.IM_A_TEAPOT);
            m.put(FOUR_HUNDRED_TWENTY_ONE, ReasonPhrase.MISDIRECTED_REQUEST);
            m.put(FOUR_HUNDRED_TWENTY_TWO, ReasonPhrase.UNPROCESSABLE_ENTITY);
            m.put(FOUR_HUNDRED_TWENTY_THREE, ReasonPhrase.LOCKED);
            m.put(FOUR_HUNDRED_TWENTY_FOUR, ReasonPhrase.FAILED_DEPENDENCY);
            m.put(FOUR_HUNDRED_TWENTY_FIVE, ReasonPhrase.TOO_EARLY);
            m.put(FOUR_HUNDRED_TWENTY_SIX, ReasonPhrase.UPGRADE_REQUIRED);
            m.put(FOUR_HUNDRED_TWENTY_EIGHT, ReasonPhrase.PRECONDITION_REQUIRED);
            m.put(FOUR_HUNDRED_TWENTY_NINE, ReasonPhrase.TOO_MANY_REQUESTS);
            m.put(FOUR_HUNDRED_THIRTY_ONE, ReasonPhrase.REQUEST_HEADER_FIELDS_TOO_LARGE);
            m.put(FOUR_HUNDRED_FIFTY_ONE, ReasonPhrase.UNAVAILABLE_FOR_LEGAL_REASONS);
            m.put(FIVE_HUNDRED, ReasonPhrase.INTERNAL_SERVER_ERROR);
            m.put(FIVE_HUNDRED_ONE, ReasonPhrase.NOT_IMPLEMENTED);
            m.put(FIVE_HUNDRED_TWO, ReasonPhrase.BAD_GATEWAY);
            m.put(FIVE_HUNDRED_THREE, ReasonPhrase.SERVICE_UNAVAILABLE);
            m.put(FIVE_HUNDRED_FOUR, ReasonPhrase.GATEWAY_TIMEOUT);
            m.put(FIVE_HUNDRED_FIVE, ReasonPhrase.HTTP_VERSION_NOT_SUPPORTED);
            m.put(FIVE_HUNDRED_SIX, ReasonPhrase.VARIANT_ALSO_NEGOTIATES);
            m.put(FIVE_HUNDRED_SEVEN, ReasonPhrase.INSUFFICIENT_STORAGE);
            m.put(FIVE_HUNDRED_EIGHT, ReasonPhrase.LOOP_DETECTED);
            m.put(FIVE_HUNDRED_TEN, ReasonPhrase.NOT_EXTENDED);
            m.put(FIVE_HUNDRED_ELEVEN, ReasonPhrase.NETWORK_AUTHENTICATION_REQUIRED);
            return Collections.unmodifiableMap(m);
        }

        private static Map<String, Integer> buildNames() {
            Map<String, Integer> m = new LinkedHashMap<>();
            PHRASES.forEach((code, phrase) -> {
                var old = m.put(toName(phrase), code);
                assert old == null;
            });
            return Collections.unmodifiableMap(m);
        }

        private static String toName(String phrase) {
            return phrase.toLowerCase(Locale.ROOT)
                         .replace("'", "")
                         .replaceAll("[^a-z0-9]+", "_");
        }

        /**
         * Returns {@code true} if the given code is found in the table of
         * recognized status codes.
         *
         * @param code to test
         * @return see JavaDoc
         */
        public static boolean isRecognized(int code) {
            return PHRASES.containsKey(code);
        }

        /**
         * Translates a symbolic name into a status code.<p>
         *
         * The lookup is case-insensitive and surrounding whitespace is
         * ignored.
         *
         * @param name symbolic name, e.g. "not_found"
         * @return the status code, or empty if the name is not recognized
         * @throws NullPointerException if {@code name} is {@code null}
         */
        public static OptionalInt fromName(String name) {
            Integer code = NAMES.get(name.strip().toLowerCase(Locale.ROOT));
            return code == null ? OptionalInt.empty() : OptionalInt.of(code);
        }

        /**
         * Returns the reason phrase of a recognized status code.
         *
         * @param code status code
         * @return the reason phrase, or empty if the code is not recognized
         */
        public static Optional<String> reasonPhrase(int code) {
            return Optional.ofNullable(PHRASES.get(code));
        }

        /**
         * Returns {@code true} if the given code is a 3XX (Redirection).
         *
         * @param code status code
         * @return see JavaDoc
         */
        public static boolean isRedirection(int code) {
            return code >= 300 && code <= 399;
        }

        /**
         * Returns {@code true} if the given code is a 4XX (Client Error).
         *
         * @param code status code
         * @return see JavaDoc
         */
        public static boolean isClientError(int code) {
            return code >= 400 && code <= 499;
        }

        /**
         * Returns {@code true} if the given code is a 5XX (Server Error).
         *
         * @param code status code
         * @return see JavaDoc
         */
        public static boolean isServerError(int code) {
            return code >= 500 && code <= 599;
        }
    }

    /**
     * Reason phrases of the recognized status codes.
     */
    public static final class ReasonPhrase {
        private ReasonPhrase() {
            // Empty
        }

        public static final String UNKNOWN = "Unknown";
        public static final String CONTINUE = "Continue";
        public static final String SWITCHING_PROTOCOLS = "Switching Protocols";
        public static final String PROCESSING = "Processing";
        public static final String EARLY_HINTS = "Early Hints";
        public static final String OK = "OK";
        public static final String CREATED = "Created";
        public static final String ACCEPTED = "Accepted";
        public static final String NON_AUTHORITATIVE_INFORMATION = "Non-Authoritative Information";
        public static final String NO_CONTENT = "No Content";
        public static final String RESET_CONTENT = "Reset Content";
        public static final String PARTIAL_CONTENT = "Partial Content";
        public static final String MULTI_STATUS = "Multi-Status";
        public static final String ALREADY_REPORTED = "Already Reported";
        public static final String IM_USED = "IM Used";
        public static final String MULTIPLE_CHOICES = "Multiple Choices";
        public static final String MOVED_PERMANENTLY = "Moved Permanently";
        public static final String FOUND = "Found";
        public static final String SEE_OTHER = "See Other";
        public static final String NOT_MODIFIED = "Not Modified";
        public static final String USE_PROXY = "Use Proxy";
        public static final String TEMPORARY_REDIRECT = "Temporary Redirect";
        public static final String PERMANENT_REDIRECT = "Permanent Redirect";
        public static final String BAD_REQUEST = "Bad Request";
        public static final String UNAUTHORIZED = "Unauthorized";
        public static final String PAYMENT_REQUIRED = "Payment Required";
        public static final String FORBIDDEN = "Forbidden";
        public static final String NOT_FOUND = "Not Found";
        public static final String METHOD_NOT_ALLOWED = "Method Not Allowed";
        public static final String NOT_ACCEPTABLE = "Not Acceptable";
        public static final String PROXY_AUTHENTICATION_REQUIRED = "Proxy Authentication Required";
        public static final String REQUEST_TIMEOUT = "Request Timeout";
        public static final String CONFLICT = "Conflict";
        public static final String GONE = "Gone";
        public static final String LENGTH_REQUIRED = "Length Required";
        public static final String PRECONDITION_FAILED = "Precondition Failed";
        public static final String PAYLOAD_TOO_LARGE = "Payload Too Large";
        public static final String URI_TOO_LONG = "URI Too Long";
        public static final String UNSUPPORTED_MEDIA_TYPE = "Unsupported Media Type";
        public static final String RANGE_NOT_SATISFIABLE = "Range Not Satisfiable";
        public static final String EXPECTATION_FAILED = "Expectation Failed";
        public static final String IM_A_TEAPOT = "I'm a Teapot";
        public static final String MISDIRECTED_REQUEST = "Misdirected Request";
        public static final String UNPROCESSABLE_ENTITY = "Unprocessable Entity";
        public static final String LOCKED = "Locked";
        public static final String FAILED_DEPENDENCY = "Failed Dependency";
        public static final String TOO_EARLY = "Too Early";
        public static final String UPGRADE_REQUIRED = "Upgrade Required";
        public static final String PRECONDITION_REQUIRED = "Precondition Required";
        public static final String TOO_MANY_REQUESTS = "Too Many Requests";
        public static final String REQUEST_HEADER_FIELDS_TOO_LARGE = "Request Header Fields Too Large";
        public static final String UNAVAILABLE_FOR_LEGAL_REASONS = "Unavailable For Legal Reasons";
        public static final String INTERNAL_SERVER_ERROR = "Internal Server Error";
        public static final String NOT_IMPLEMENTED = "Not Implemented";
        public static final String BAD_GATEWAY = "Bad Gateway";
        public static final String SERVICE_UNAVAILABLE = "Service Unavailable";
        public static final String GATEWAY_TIMEOUT = "Gateway Timeout";
        public static final String HTTP_VERSION_NOT_SUPPORTED = "HTTP Version Not Supported";
        public static final String VARIANT_ALSO_NEGOTIATES = "Variant Also Negotiates";
        public static final String INSUFFICIENT_STORAGE = "Insufficient Storage";
        public static final String LOOP_DETECTED = "Loop Detected";
        public static final String NOT_EXTENDED = "Not Extended";
        public static final String NETWORK_AUTHENTICATION_REQUIRED = "Network Authentication Required";
    }

    /**
     * Header names used by the library.<p>
     *
     * Header names are case-insensitive. These constants use the canonical
     * casing.
     */
    public static final class HeaderName {
        private HeaderName() {
            // Empty
        }

        /** Media types acceptable for the response. */
        public static final String ACCEPT = "Accept";
        /** Media type of the body. */
        public static final String CONTENT_TYPE = "Content-Type";
        /** Target of a redirect. */
        public static final String LOCATION = "Location";
        /** Request cookies. */
        public static final String COOKIE = "Cookie";
        /** Response cookie. */
        public static final String SET_COOKIE = "Set-Cookie";
        /** Framing policy. */
        public static final String X_FRAME_OPTIONS = "X-Frame-Options";
        /** MIME sniffing policy. */
        public static final String X_CONTENT_TYPE_OPTIONS = "X-Content-Type-Options";
        /** Legacy XSS filter policy. */
        public static final String X_XSS_PROTECTION = "X-XSS-Protection";
        /** Cross-domain policy for Flash and PDF clients. */
        public static final String X_PERMITTED_CROSS_DOMAIN_POLICIES = "X-Permitted-Cross-Domain-Policies";
        /** Referrer policy. */
        public static final String REFERRER_POLICY = "Referrer-Policy";
        /** Legacy IE download option. */
        public static final String X_DOWNLOAD_OPTIONS = "X-Download-Options";
    }
}
