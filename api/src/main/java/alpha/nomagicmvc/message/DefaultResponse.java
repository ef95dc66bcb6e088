package alpha.nomagicmvc.message;

import alpha.nomagicmvc.HttpConstants;
import alpha.nomagicmvc.util.AbstractImmutableBuilder;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Consumer;

import static alpha.nomagicmvc.HttpConstants.StatusCode.THREE_HUNDRED_FOUR;
import static alpha.nomagicmvc.HttpConstants.StatusCode.TWO_HUNDRED_FOUR;
import static java.lang.String.CASE_INSENSITIVE_ORDER;
import static java.util.Collections.unmodifiableMap;
import static java.util.Objects.requireNonNull;

final class DefaultResponse implements Response
{
    private static final byte[] EMPTY = new byte[0];

    private final int statusCode;
    private final String reasonPhrase;
    private final Map<String, List<String>> headers;
    private final byte[] body;
    private final DefaultBuilder origin;

    private DefaultResponse(
            int statusCode,
            String reasonPhrase,
            Map<String, List<String>> headers,
            byte[] body,
            DefaultBuilder origin)
    {
        this.statusCode = statusCode;
        this.reasonPhrase = reasonPhrase;
        this.headers = unmodifiableMap(headers);
        this.body = body;
        this.origin = origin;
    }

    @Override
    public int statusCode() {
        return statusCode;
    }

    @Override
    public String reasonPhrase() {
        return reasonPhrase;
    }

    @Override
    public Map<String, List<String>> headers() {
        return headers;
    }

    @Override
    public byte[] body() {
        return body.clone();
    }

    @Override
    public Response.Builder toBuilder() {
        return origin;
    }

    @Override
    public String toString() {
        return DefaultResponse.class.getSimpleName() + "{" +
                "statusCode=" + statusCode +
                ", reasonPhrase='" + reasonPhrase + '\'' +
                ", headers=" + headers +
                ", body.length=" + body.length +
                '}';
    }

    static final class DefaultBuilder
            extends AbstractImmutableBuilder<DefaultBuilder.MutableState>
            implements Response.Builder
    {
        private static class MutableState {
            Integer statusCode;
            String reasonPhrase;
            final Map<String, List<String>> headers = new TreeMap<>(CASE_INSENSITIVE_ORDER);
            byte[] body;

            void addHeader(boolean clearFirst, String name, String value) {
                var vals = headers.computeIfAbsent(name, k -> new ArrayList<>(1));
                if (clearFirst) {
                    vals.clear();
                }
                vals.add(value);
            }
        }

        static final Response.Builder ROOT = new DefaultBuilder();

        private DefaultBuilder() {
            // super()
        }

        private DefaultBuilder(DefaultBuilder prev, Consumer<MutableState> modifier) {
            super(prev, modifier);
        }

        @Override
        public Response.Builder statusCode(int statusCode) {
            return new DefaultBuilder(this, s -> {
                s.statusCode = statusCode;
                s.reasonPhrase = null;
            });
        }

        @Override
        public Response.Builder reasonPhrase(String reasonPhrase) {
            requireNonNull(reasonPhrase, "reasonPhrase");
            return new DefaultBuilder(this, s -> s.reasonPhrase = reasonPhrase);
        }

        @Override
        public Response.Builder header(String name, String value) {
            final String key = requireNotEmpty(name);
            requireNonNull(value, "value");
            return new DefaultBuilder(this, s -> s.addHeader(true, key, value));
        }

        @Override
        public Response.Builder addHeader(String name, String value) {
            final String key = requireNotEmpty(name);
            requireNonNull(value, "value");
            return new DefaultBuilder(this, s -> s.addHeader(false, key, value));
        }

        @Override
        public Response.Builder removeHeader(String name) {
            final String key = requireNotEmpty(name);
            return new DefaultBuilder(this, s -> s.headers.remove(key));
        }

        @Override
        public Response.Builder body(byte[] body) {
            final byte[] copy = body.clone();
            return new DefaultBuilder(this, s -> s.body = copy);
        }

        @Override
        public Response build() {
            MutableState s = constructState(MutableState::new);
            if (s.statusCode == null) {
                throw new IllegalStateException("Status code not set.");
            }
            setDefaults(s);

            if ((s.statusCode == TWO_HUNDRED_FOUR ||
                 s.statusCode == THREE_HUNDRED_FOUR) && s.body.length > 0) {
                throw new IllegalStateException(
                        "Presumably a body in a " + s.statusCode + " (" + s.reasonPhrase + ") response.");
            }

            Map<String, List<String>> h = new TreeMap<>(CASE_INSENSITIVE_ORDER);
            s.headers.forEach((k, v) -> {
                if (!v.isEmpty()) {
                    h.put(k, List.copyOf(v));
                }
            });
            return new DefaultResponse(s.statusCode, s.reasonPhrase, h, s.body, this);
        }

        private static String requireNotEmpty(String name) {
            if (name.isEmpty()) {
                throw new IllegalArgumentException("Empty header name");
            }
            return name;
        }

        private static void setDefaults(MutableState s) {
            if (s.reasonPhrase == null) {
                s.reasonPhrase = HttpConstants.StatusCode.reasonPhrase(s.statusCode)
                        .orElse(HttpConstants.ReasonPhrase.UNKNOWN); }

            if (s.body == null) {
                s.body = EMPTY; }
        }
    }
}
