package alpha.nomagicmvc;

import alpha.nomagicmvc.render.Format;
import alpha.nomagicmvc.util.AbstractImmutableBuilder;

import java.util.List;
import java.util.function.Consumer;

import static java.util.Objects.requireNonNull;

final class DefaultConfig implements Config {
    private final Builder      builder;
    private final List<Format> acceptedFormats,
                               layoutFormats;
    private final Format       defaultFormat;
    private final String       formatParameter,
                               defaultLayout,
                               layoutNamespace,
                               flashSessionKey;
    private final boolean      persistFlashOnRedirect;

    DefaultConfig(Builder b, DefaultBuilder.MutableState s) {
        builder                = b;
        acceptedFormats        = s.acceptedFormats;
        layoutFormats          = s.layoutFormats;
        defaultFormat          = s.defaultFormat;
        formatParameter        = s.formatParameter;
        defaultLayout          = s.defaultLayout;
        layoutNamespace        = s.layoutNamespace;
        flashSessionKey        = s.flashSessionKey;
        persistFlashOnRedirect = s.persistFlashOnRedirect;
    }

    @Override
    public List<Format> acceptedFormats() {
        return acceptedFormats;
    }

    @Override
    public Format defaultFormat() {
        return defaultFormat;
    }

    @Override
    public String formatParameter() {
        return formatParameter;
    }

    @Override
    public String defaultLayout() {
        return defaultLayout;
    }

    @Override
    public String layoutNamespace() {
        return layoutNamespace;
    }

    @Override
    public List<Format> layoutFormats() {
        return layoutFormats;
    }

    @Override
    public String flashSessionKey() {
        return flashSessionKey;
    }

    @Override
    public boolean persistFlashOnRedirect() {
        return persistFlashOnRedirect;
    }

    @Override
    public Builder toBuilder() {
        return builder;
    }

    @Override
    public String toString() {
        return DefaultConfig.class.getSimpleName() + "{" +
                "acceptedFormats=" + acceptedFormats +
                ", defaultFormat=" + defaultFormat +
                ", formatParameter='" + formatParameter + '\'' +
                ", defaultLayout='" + defaultLayout + '\'' +
                ", layoutNamespace='" + layoutNamespace + '\'' +
                ", layoutFormats=" + layoutFormats +
                ", flashSessionKey='" + flashSessionKey + '\'' +
                ", persistFlashOnRedirect=" + persistFlashOnRedirect + '}';
    }

    static final class DefaultBuilder
            extends AbstractImmutableBuilder<DefaultBuilder.MutableState>
            implements Builder
    {
        static final DefaultBuilder ROOT = new DefaultBuilder();

        static class MutableState {
            List<Format> acceptedFormats        = List.of(Format.HTML),
                         layoutFormats          = List.of(Format.HTML);
            Format       defaultFormat          = Format.HTML;
            String       formatParameter        = "_format",
                         defaultLayout          = "app",
                         layoutNamespace        = "layouts",
                         flashSessionKey        = "alpha.nomagicmvc.flash";
            boolean      persistFlashOnRedirect = true;
        }

        private DefaultBuilder() {
            // super()
        }

        private DefaultBuilder(DefaultBuilder prev, Consumer<MutableState> modifier) {
            super(prev, modifier);
        }

        @Override
        public Builder acceptedFormats(Format... newVal) {
            final var v = List.of(newVal);
            return new DefaultBuilder(this, s -> s.acceptedFormats = v);
        }

        @Override
        public Builder defaultFormat(Format newVal) {
            requireNonNull(newVal);
            return new DefaultBuilder(this, s -> s.defaultFormat = newVal);
        }

        @Override
        public Builder formatParameter(String newVal) {
            requireNonNull(newVal);
            return new DefaultBuilder(this, s -> s.formatParameter = newVal);
        }

        @Override
        public Builder defaultLayout(String newVal) {
            requireNonNull(newVal);
            return new DefaultBuilder(this, s -> s.defaultLayout = newVal);
        }

        @Override
        public Builder layoutNamespace(String newVal) {
            requireNonNull(newVal);
            return new DefaultBuilder(this, s -> s.layoutNamespace = newVal);
        }

        @Override
        public Builder layoutFormats(Format... newVal) {
            final var v = List.of(newVal);
            return new DefaultBuilder(this, s -> s.layoutFormats = v);
        }

        @Override
        public Builder flashSessionKey(String newVal) {
            requireNonNull(newVal);
            return new DefaultBuilder(this, s -> s.flashSessionKey = newVal);
        }

        @Override
        public Builder persistFlashOnRedirect(boolean newVal) {
            return new DefaultBuilder(this, s -> s.persistFlashOnRedirect = newVal);
        }

        @Override
        public Config build() {
            var s = constructState(MutableState::new);
            requireNotEmpty(s.acceptedFormats.isEmpty(), "acceptedFormats");
            requireNotEmpty(s.formatParameter.isEmpty(), "formatParameter");
            requireNotEmpty(s.layoutNamespace.isEmpty(), "layoutNamespace");
            requireNotEmpty(s.flashSessionKey.isEmpty(), "flashSessionKey");
            if (s.acceptedFormats.stream().distinct().count() != s.acceptedFormats.size()) {
                throw new IllegalArgumentException("Duplicated accepted formats: " + s.acceptedFormats);
            }
            return new DefaultConfig(this, s);
        }

        private static void requireNotEmpty(boolean empty, String option) {
            if (empty) {
                throw new IllegalArgumentException("Empty " + option + ".");
            }
        }
    }
}
