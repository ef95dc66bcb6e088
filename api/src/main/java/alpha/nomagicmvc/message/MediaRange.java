package alpha.nomagicmvc.message;

import java.util.Map;

/**
 * A media range is a media type that may contain wildcards and carries a
 * quality (the "q" parameter) used during content negotiation.<p>
 *
 * A quality of zero means "not acceptable".
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class MediaRange extends MediaType
{
    private final double quality;

    MediaRange(String text, String type, String subtype, Map<String, String> params, double quality) {
        super(text, type, subtype, params);
        this.quality = quality;
    }

    /**
     * Returns the quality (the value of the "q" parameter).<p>
     *
     * Defaults to 1 if the parameter was not specified.
     *
     * @return the quality
     */
    public double quality() {
        return quality;
    }
}
