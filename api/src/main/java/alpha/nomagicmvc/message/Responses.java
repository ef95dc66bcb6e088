package alpha.nomagicmvc.message;

import alpha.nomagicmvc.HttpConstants;
import alpha.nomagicmvc.HttpConstants.StatusCode;

import static alpha.nomagicmvc.HttpConstants.HeaderName.CONTENT_TYPE;
import static alpha.nomagicmvc.HttpConstants.HeaderName.LOCATION;
import static alpha.nomagicmvc.HttpConstants.StatusCode.FIVE_HUNDRED;
import static alpha.nomagicmvc.HttpConstants.StatusCode.FOUR_HUNDRED_FOUR;
import static alpha.nomagicmvc.HttpConstants.StatusCode.FOUR_HUNDRED_SIX;
import static alpha.nomagicmvc.HttpConstants.StatusCode.THREE_HUNDRED_TWO;
import static alpha.nomagicmvc.HttpConstants.StatusCode.TWO_HUNDRED;
import static alpha.nomagicmvc.HttpConstants.StatusCode.TWO_HUNDRED_FOUR;
import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Factories of {@code Response}s.<p>
 *
 * Although {@link Response} has no mutating methods, modifications of any
 * response are possible by using {@code toBuilder()}.
 *
 * <pre>
 *   Response update = Responses.notFound()
 *                              .toBuilder()
 *                              .header("Cache-Control", "no-store")
 *                              .build();
 * </pre>
 *
 * Bodiless responses are cached. Responses with a body are created anew each
 * time.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class Responses
{
    // Declaration of methods after status() follows ascending status-code order

    private static final Response
            OK          = status0(TWO_HUNDRED),
            NO_CONTENT  = status0(TWO_HUNDRED_FOUR),
            NOT_FOUND   = status0(FOUR_HUNDRED_FOUR),
            NOT_ACCEPTABLE = status0(FOUR_HUNDRED_SIX),
            INTERNAL_SERVER_ERROR = status0(FIVE_HUNDRED);

    private Responses() {
        // Empty
    }

    /**
     * {@return a bodiless response with the specified status code}<p>
     *
     * The reason phrase is the one registered in {@link StatusCode}, or
     * "Unknown".
     *
     * @param code HTTP status code
     * @see HttpConstants.StatusCode
     */
    public static Response status(int code) {
        return switch (code) {
            case TWO_HUNDRED -> OK;
            case TWO_HUNDRED_FOUR -> NO_CONTENT;
            case FOUR_HUNDRED_FOUR -> NOT_FOUND;
            case FOUR_HUNDRED_SIX -> NOT_ACCEPTABLE;
            case FIVE_HUNDRED -> INTERNAL_SERVER_ERROR;
            default -> status0(code);
        };
    }

    /**
     * {@return a response with the given status code, content-type and body}
     *
     * @param code HTTP status code
     * @param contentType of body
     * @param body to encode using UTF-8
     *
     * @throws NullPointerException if any reference argument is {@code null}
     */
    public static Response body(int code, MediaType contentType, String body) {
        return Response.builder(code)
                .header(CONTENT_TYPE, contentType.toString())
                .body(body.getBytes(UTF_8))
                .build();
    }

    /**
     * {@return a cached bodiless 200 (OK) response}
     *
     * @see StatusCode#TWO_HUNDRED
     */
    public static Response ok() {
        return OK;
    }

    /**
     * {@return a new 200 (OK) response with a text body}<p>
     *
     * The content-type header will be set to "text/plain; charset=utf-8".
     *
     * @param textPlain message body
     * @see StatusCode#TWO_HUNDRED
     */
    public static Response text(String textPlain) {
        return body(TWO_HUNDRED, MediaType.TEXT_PLAIN.withCharsetUtf8(), textPlain);
    }

    /**
     * {@return a new 200 (OK) response with a HTML body}<p>
     *
     * The content-type header will be set to "text/html; charset=utf-8".
     *
     * @param textHtml message body
     * @see StatusCode#TWO_HUNDRED
     */
    public static Response html(String textHtml) {
        return body(TWO_HUNDRED, MediaType.TEXT_HTML.withCharsetUtf8(), textHtml);
    }

    /**
     * {@return a cached 204 (No Content) response}
     *
     * @see StatusCode#TWO_HUNDRED_FOUR
     */
    public static Response noContent() {
        return NO_CONTENT;
    }

    /**
     * {@return a new 302 (Found) response with the given "Location"}
     *
     * @param location redirect target
     * @see StatusCode#THREE_HUNDRED_TWO
     */
    public static Response found(String location) {
        return Response.builder(THREE_HUNDRED_TWO)
                .header(LOCATION, location)
                .build();
    }

    /**
     * {@return a cached 404 (Not Found) response}
     *
     * @see StatusCode#FOUR_HUNDRED_FOUR
     */
    public static Response notFound() {
        return NOT_FOUND;
    }

    /**
     * {@return a cached 406 (Not Acceptable) response}
     *
     * @see StatusCode#FOUR_HUNDRED_SIX
     */
    public static Response notAcceptable() {
        return NOT_ACCEPTABLE;
    }

    /**
     * {@return a cached 500 (Internal Server Error) response}
     *
     * @see StatusCode#FIVE_HUNDRED
     */
    public static Response internalServerError() {
        return INTERNAL_SERVER_ERROR;
    }

    private static Response status0(int code) {
        return Response.builder(code).build();
    }
}
