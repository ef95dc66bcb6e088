package alpha.nomagicmvc.core;

import alpha.nomagicmvc.Config;
import alpha.nomagicmvc.message.MediaRange;
import alpha.nomagicmvc.message.MediaType;
import alpha.nomagicmvc.message.MediaTypeParseException;
import alpha.nomagicmvc.message.Request;
import alpha.nomagicmvc.render.Format;
import alpha.nomagicmvc.render.FormatNotAcceptedException;
import alpha.nomagicmvc.util.Strings;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import static alpha.nomagicmvc.HttpConstants.HeaderName.ACCEPT;
import static java.lang.System.Logger.Level.DEBUG;

/**
 * Resolves the format of a response.<p>
 *
 * The format is resolved in this order: the explicit format, the format
 * request parameter, the "Accept" header and lastly the default format. An
 * explicit format and the format parameter must be accepted. The "Accept"
 * header is intersected with the accepted formats; if it rules out all of
 * them, the format is not acceptable. A header that contains nothing but
 * full wildcards ("*&#47;*") expresses no preference.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class FormatNegotiator
{
    private static final System.Logger LOG
            = System.getLogger(FormatNegotiator.class.getPackageName());

    private FormatNegotiator() {
        // Empty
    }

    /**
     * Resolves the format of a response.
     *
     * @param explicit format put by the application (may be {@code null})
     * @param accepted formats, in order of preference (not empty)
     * @param req inbound request
     * @param config controller configuration
     *
     * @return the resolved format
     *
     * @throws FormatNotAcceptedException
     *             if the resolved format is not accepted
     */
    static Format negotiate(
            Format explicit, List<Format> accepted, Request req, Config config)
    {
        if (explicit != null) {
            return require(explicit.name(), accepted);
        }
        var param = req.param(config.formatParameter());
        if (param.isPresent()) {
            LOG.log(DEBUG, () -> "Format parameter: " + param.get());
            return require(param.get(), accepted);
        }
        var ranges = parseAccept(req);
        if (!ranges.isEmpty() && !allWildcards(ranges)) {
            return byAccept(ranges, accepted).orElseThrow(() ->
                    new FormatNotAcceptedException(
                            String.join(", ", req.headers().get(ACCEPT)), accepted));
        }
        return accepted.contains(config.defaultFormat()) ?
                config.defaultFormat() : accepted.get(0);
    }

    /**
     * Returns the accepted format with the given name.
     *
     * @param name of format
     * @param accepted formats
     * @return the format
     * @throws FormatNotAcceptedException if the format is not accepted
     */
    static Format require(String name, List<Format> accepted) {
        return accepted.stream()
                .filter(f -> f.name().equals(name))
                .findFirst()
                .orElseThrow(() -> new FormatNotAcceptedException(name, accepted));
    }

    private static List<MediaType> parseAccept(Request req) {
        var headers = req.headers().get(ACCEPT);
        if (headers == null) {
            return List.of();
        }
        var ranges = new ArrayList<MediaType>();
        headers.stream()
               .flatMap(h -> Strings.split(h, ',', '"'))
               .map(String::strip)
               .filter(s -> !s.isEmpty())
               .forEach(s -> {
                   try {
                       ranges.add(MediaType.parse(s));
                   } catch (MediaTypeParseException e) {
                       LOG.log(DEBUG, () -> "Ignoring unparsable media range: " + e.getMessage());
                   }
               });
        return ranges;
    }

    private static boolean allWildcards(List<MediaType> ranges) {
        return ranges.stream().allMatch(r ->
                r.type().equals("*") && quality(r) > 0);
    }

    private static double quality(MediaType t) {
        return t instanceof MediaRange r ? r.quality() : 1;
    }

    // Type and subtype only, parameters of the range are ignored
    private static boolean matches(MediaType range, MediaType type) {
        return (range.type().equals("*") || range.type().equals(type.type())) &&
               (range.subtype().equals("*") || range.subtype().equals(type.subtype()));
    }

    private static Optional<Format> byAccept(List<MediaType> ranges, List<Format> accepted) {
        Format best = null;
        double bestQ = 0;
        for (Format f : accepted) {
            double q = ranges.stream()
                    .filter(r -> matches(r, f.mediaType()))
                    .min(Comparator.comparingInt(MediaType::specificity))
                    .map(FormatNegotiator::quality)
                    .orElse(0.);
            if (q > bestQ) {
                best = f;
                bestQ = q;
            }
        }
        final Format winner = best;
        LOG.log(DEBUG, () -> "Negotiated format by Accept header: " + winner);
        return Optional.ofNullable(winner);
    }
}
