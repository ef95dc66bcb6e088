package alpha.nomagicmvc.render;

import alpha.nomagicmvc.handler.HasResponse;
import alpha.nomagicmvc.message.Response;
import alpha.nomagicmvc.message.Responses;

import java.io.Serial;
import java.util.List;

/**
 * Thrown when the resolved format of a response is not accepted by the
 * controller or the request.<p>
 *
 * The default exception handler translates this exception to a 406 (Not
 * Acceptable) response.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class FormatNotAcceptedException
             extends RuntimeException implements HasResponse
{
    @Serial
    private static final long serialVersionUID = 1L;

    private final String format;
    private final transient List<Format> accepted;

    /**
     * Initializes this object.
     *
     * @param format name of the rejected format
     * @param accepted the accepted formats
     */
    public FormatNotAcceptedException(String format, List<Format> accepted) {
        super("Format \"" + format + "\" not accepted, expected one of " + accepted + ".");
        this.format = format;
        this.accepted = List.copyOf(accepted);
    }

    /**
     * {@return the name of the rejected format}
     */
    public String format() {
        return format;
    }

    /**
     * {@return the accepted formats}
     */
    public List<Format> accepted() {
        return accepted;
    }

    /**
     * Returns {@link Responses#notAcceptable()}.
     *
     * @return see JavaDoc
     */
    @Override
    public Response getResponse() {
        return Responses.notAcceptable();
    }
}
