package alpha.nomagicmvc.message;

import alpha.nomagicmvc.util.AbstractImmutableBuilder;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Consumer;

import static java.lang.String.CASE_INSENSITIVE_ORDER;
import static java.util.Collections.unmodifiableMap;
import static java.util.Objects.requireNonNull;

final class DefaultRequest implements Request
{
    private final String method, path;
    private final Map<String, String> params;
    private final Map<String, List<String>> headers;

    private DefaultRequest(
            String method, String path,
            Map<String, String> params,
            Map<String, List<String>> headers)
    {
        this.method  = method;
        this.path    = path;
        this.params  = unmodifiableMap(params);
        this.headers = unmodifiableMap(headers);
    }

    @Override
    public String method() {
        return method;
    }

    @Override
    public String path() {
        return path;
    }

    @Override
    public Map<String, String> params() {
        return params;
    }

    @Override
    public Map<String, List<String>> headers() {
        return headers;
    }

    @Override
    public String toString() {
        return DefaultRequest.class.getSimpleName() + "{" +
                "method=" + method +
                ", path=" + path +
                ", params=" + params.keySet() +
                ", headers=" + headers.keySet() + '}';
    }

    static final class DefaultBuilder
            extends AbstractImmutableBuilder<DefaultBuilder.MutableState>
            implements Request.Builder
    {
        private static class MutableState {
            String method, path;
            final Map<String, String> params = new LinkedHashMap<>();
            final Map<String, List<String>> headers = new TreeMap<>(CASE_INSENSITIVE_ORDER);
        }

        static final Request.Builder ROOT = new DefaultBuilder();

        private DefaultBuilder() {
            // super()
        }

        private DefaultBuilder(DefaultBuilder prev, Consumer<MutableState> modifier) {
            super(prev, modifier);
        }

        @Override
        public Request.Builder method(String method) {
            if (method.isEmpty()) {
                throw new IllegalArgumentException("Empty method.");
            }
            return new DefaultBuilder(this, s -> s.method = method);
        }

        @Override
        public Request.Builder path(String path) {
            if (!path.startsWith("/")) {
                throw new IllegalArgumentException(
                        "Path must start with a forward slash: " + path);
            }
            return new DefaultBuilder(this, s -> s.path = path);
        }

        @Override
        public Request.Builder param(String name, String value) {
            requireNonNull(name, "name");
            requireNonNull(value, "value");
            return new DefaultBuilder(this, s -> s.params.put(name, value));
        }

        @Override
        public Request.Builder header(String name, String value) {
            requireNonNull(name, "name");
            requireNonNull(value, "value");
            return new DefaultBuilder(this, s ->
                    s.headers.computeIfAbsent(name, k -> new ArrayList<>()).add(value));
        }

        @Override
        public Request build() {
            MutableState s = constructState(MutableState::new);
            if (s.method == null || s.path == null) {
                throw new IllegalStateException("Method and path are required.");
            }
            Map<String, List<String>> h = new TreeMap<>(CASE_INSENSITIVE_ORDER);
            s.headers.forEach((k, v) -> h.put(k, List.copyOf(v)));
            return new DefaultRequest(s.method, s.path, s.params, h);
        }
    }
}
