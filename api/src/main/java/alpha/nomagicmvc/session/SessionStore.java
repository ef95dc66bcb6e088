package alpha.nomagicmvc.session;

import alpha.nomagicmvc.context.Context;
import alpha.nomagicmvc.message.Request;

import java.util.Map;

/**
 * Loads and saves the session of a client.<p>
 *
 * The session is a mapping persisted across requests of the same client. How
 * and where it is stored is up to the implementation; a signed cookie, a
 * server-side cache or a database. The session is loaded by
 * {@link Context#fetchSession()} and saved by the fetch-session stage just
 * before the response is committed.<p>
 *
 * Values should be plain data: strings, numbers, booleans, lists and maps.<p>
 *
 * The implementation must be thread-safe.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public interface SessionStore
{
    /**
     * Loads the session of the client that sent the request.<p>
     *
     * A request without a session, or with a session that can not be
     * trusted, loads as an empty map.
     *
     * @param request inbound request
     * @return the session (never {@code null})
     */
    Map<String, Object> load(Request request);

    /**
     * Saves the session.<p>
     *
     * Called before the response is committed. The implementation may put
     * response headers on the context, e.g. "Set-Cookie".
     *
     * @param session to save
     * @param ctx request context (not yet committed)
     */
    void save(Map<String, Object> session, Context ctx);

    /**
     * Drops the session of the client.<p>
     *
     * Called before the response is committed.
     *
     * @param ctx request context (not yet committed)
     */
    void drop(Context ctx);
}
