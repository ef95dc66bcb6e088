package alpha.nomagicmvc.testutil;

import alpha.nomagicmvc.context.Context;
import alpha.nomagicmvc.message.Request;
import alpha.nomagicmvc.session.SessionStore;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An in-memory session store for a single client.<p>
 *
 * All requests share the same session, which makes it possible to follow a
 * redirect with a second request and observe what survived. The store also
 * counts how many times it was saved and dropped. Not thread-safe.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class TestSessions implements SessionStore
{
    private Map<String, Object> stored = new LinkedHashMap<>();
    private int saves, drops;

    @Override
    public Map<String, Object> load(Request request) {
        return new HashMap<>(stored);
    }

    @Override
    public void save(Map<String, Object> session, Context ctx) {
        stored = new LinkedHashMap<>(session);
        ++saves;
    }

    @Override
    public void drop(Context ctx) {
        stored = new LinkedHashMap<>();
        ++drops;
    }

    /**
     * Replaces the stored session.
     *
     * @param session new session
     * @return this for chaining/fluency
     */
    public TestSessions put(Map<String, Object> session) {
        stored = new LinkedHashMap<>(session);
        return this;
    }

    /**
     * {@return a copy of the stored session}
     */
    public Map<String, Object> stored() {
        return new LinkedHashMap<>(stored);
    }

    /**
     * {@return the number of saves}
     */
    public int saves() {
        return saves;
    }

    /**
     * {@return the number of drops}
     */
    public int drops() {
        return drops;
    }
}
