package alpha.nomagicmvc.flash;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A keyed accumulator of messages meant to be shown once, typically across a
 * redirect.<p>
 *
 * Messages put in the flash are visible for the remainder of the current
 * request. To make them visible to the next request, they must be persisted,
 * either explicitly using {@link #persist(String)} or {@link #persistAll()},
 * or implicitly by redirecting when
 * {@link alpha.nomagicmvc.Config#persistFlashOnRedirect()} is enabled. A
 * redirect only persists messages put during the current request.
 * Persisted messages are written to the session when the response is
 * committed, are read back by the next request that fetches the flash, and
 * then expire whether they are read or not.
 *
 * <pre>
 *   // POST /users
 *   ctx.flash().put("info", "User created.");
 *   ctx.redirect(Redirect.to("/users"));
 *
 *   // GET /users
 *   ctx.flash().get("info"); // Optional[User created.]
 * </pre>
 *
 * An absent key is treated as an empty list; no operation throws for a missing
 * key. {@code null} keys and messages are rejected.<p>
 *
 * The flash is per-request state and is not thread-safe.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public interface Flash
{
    /**
     * Appends a message.
     *
     * @param key of message
     * @param message to append
     * @return this (for chaining/fluency)
     * @throws NullPointerException if any argument is {@code null}
     */
    Flash put(String key, String message);

    /**
     * Returns the first message of a key.<p>
     *
     * This method does not remove the message.
     *
     * @param key of message
     * @return the first message, if present
     * @throws NullPointerException if {@code key} is {@code null}
     */
    Optional<String> get(String key);

    /**
     * Returns all messages of a key, in the order they were put.<p>
     *
     * This method does not remove the messages.
     *
     * @param key of messages
     * @return an unmodifiable list, possibly empty
     * @throws NullPointerException if {@code key} is {@code null}
     */
    List<String> getAll(String key);

    /**
     * Returns and removes all messages of a key.<p>
     *
     * Messages persisted for the key are also removed.
     *
     * @param key of messages
     * @return an unmodifiable list, possibly empty
     * @throws NullPointerException if {@code key} is {@code null}
     */
    List<String> popAll(String key);

    /**
     * Persists the current messages of a key for the next request.<p>
     *
     * The messages are snapshotted; messages put after this call are not
     * persisted unless the key is persisted again. Persisting a key without
     * messages has no effect.
     *
     * @param key of messages
     * @return this (for chaining/fluency)
     * @throws NullPointerException if {@code key} is {@code null}
     */
    Flash persist(String key);

    /**
     * Persists the current messages of all keys for the next request.
     *
     * @return this (for chaining/fluency)
     * @see #persist(String)
     */
    Flash persistAll();

    /**
     * Removes all keys, persisted or not.
     *
     * @return this (for chaining/fluency)
     */
    Flash clear();

    /**
     * {@return the keys that have at least one message}
     */
    Set<String> keys();

    /**
     * {@return {@code true} if there are no messages}
     */
    boolean isEmpty();

    /**
     * Returns all messages of all keys.<p>
     *
     * The returned map is what templates receive as the "flash" assign.
     *
     * @return an unmodifiable snapshot
     */
    Map<String, List<String>> asMap();

    /**
     * Returns the persisted messages.
     *
     * @return an unmodifiable snapshot
     */
    Map<String, List<String>> persisted();
}
