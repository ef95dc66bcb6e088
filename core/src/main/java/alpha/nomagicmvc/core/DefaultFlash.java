package alpha.nomagicmvc.core;

import alpha.nomagicmvc.flash.Flash;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static java.lang.System.Logger.Level.DEBUG;
import static java.util.Collections.unmodifiableMap;
import static java.util.Objects.requireNonNull;

/**
 * Default implementation of {@link Flash}.<p>
 *
 * Messages hydrated from the session are current messages of this request,
 * but they are not persisted again unless asked to. {@link #persistPut()}
 * only persists messages put during this request.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class DefaultFlash implements Flash
{
    private static final System.Logger LOG
            = System.getLogger(DefaultFlash.class.getPackageName());

    /**
     * Creates a flash from the value stored in the session.<p>
     *
     * The value is expected to be a map of string keys to lists of strings,
     * as written by {@link #toSessionValue()}. Anything else is ignored.
     *
     * @param sessionValue value from session (may be {@code null})
     * @return a flash
     */
    static DefaultFlash hydrate(Object sessionValue) {
        var f = new DefaultFlash();
        if (sessionValue == null) {
            return f;
        }
        if (!(sessionValue instanceof Map<?, ?> map)) {
            LOG.log(DEBUG, () -> "Ignoring malformed flash in session: " + sessionValue);
            return f;
        }
        map.forEach((k, v) -> {
            if (k instanceof String key && v instanceof Collection<?> msgs) {
                msgs.forEach(m -> {
                    if (m != null) {
                        add(f.messages, key, m.toString());
                    }
                });
            }
        });
        return f;
    }

    private final Map<String, List<String>> messages = new LinkedHashMap<>();
    private final Map<String, List<String>> persisted = new LinkedHashMap<>();
    // Subset of messages, excluding those hydrated
    private final Map<String, List<String>> put = new LinkedHashMap<>();

    @Override
    public Flash put(String key, String message) {
        requireNonNull(key, "key");
        requireNonNull(message, "message");
        add(messages, key, message);
        add(put, key, message);
        return this;
    }

    private static void add(Map<String, List<String>> map, String key, String message) {
        map.computeIfAbsent(key, k -> new ArrayList<>()).add(message);
    }

    @Override
    public Optional<String> get(String key) {
        var msgs = messages.get(requireNonNull(key));
        return msgs == null ? Optional.empty() : Optional.of(msgs.get(0));
    }

    @Override
    public List<String> getAll(String key) {
        var msgs = messages.get(requireNonNull(key));
        return msgs == null ? List.of() : List.copyOf(msgs);
    }

    @Override
    public List<String> popAll(String key) {
        requireNonNull(key);
        persisted.remove(key);
        put.remove(key);
        var msgs = messages.remove(key);
        return msgs == null ? List.of() : List.copyOf(msgs);
    }

    @Override
    public Flash persist(String key) {
        var msgs = messages.get(requireNonNull(key));
        if (msgs != null) {
            persisted.put(key, List.copyOf(msgs));
        }
        return this;
    }

    @Override
    public Flash persistAll() {
        messages.keySet().forEach(this::persist);
        return this;
    }

    /**
     * Persists the messages put during this request.<p>
     *
     * Messages hydrated from the session are not persisted again by this
     * method. A key already persisted keeps its snapshot.
     *
     * @return this (for chaining/fluency)
     */
    DefaultFlash persistPut() {
        put.forEach((key, msgs) -> persisted.putIfAbsent(key, List.copyOf(msgs)));
        return this;
    }

    @Override
    public Flash clear() {
        messages.clear();
        persisted.clear();
        put.clear();
        return this;
    }

    @Override
    public Set<String> keys() {
        return Set.copyOf(messages.keySet());
    }

    @Override
    public boolean isEmpty() {
        return messages.isEmpty();
    }

    @Override
    public Map<String, List<String>> asMap() {
        return snapshot(messages);
    }

    @Override
    public Map<String, List<String>> persisted() {
        return snapshot(persisted);
    }

    /**
     * Returns the persisted messages in a form suitable for the session, or
     * {@code null} if nothing is persisted.
     */
    Map<String, List<String>> toSessionValue() {
        return persisted.isEmpty() ? null : snapshot(persisted);
    }

    private static Map<String, List<String>> snapshot(Map<String, List<String>> map) {
        var copy = new LinkedHashMap<String, List<String>>();
        map.forEach((k, v) -> copy.put(k, List.copyOf(v)));
        return unmodifiableMap(copy);
    }

    @Override
    public String toString() {
        return DefaultFlash.class.getSimpleName() + "{" +
                "messages=" + messages +
                ", persisted=" + persisted.keySet() + '}';
    }
}
