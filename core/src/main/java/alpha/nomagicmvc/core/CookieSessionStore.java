package alpha.nomagicmvc.core;

import alpha.nomagicmvc.context.Context;
import alpha.nomagicmvc.message.Request;
import alpha.nomagicmvc.session.SessionStore;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.Base64;
import java.util.HashMap;
import java.util.Map;

import static alpha.nomagicmvc.HttpConstants.HeaderName.SET_COOKIE;
import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.WARNING;
import static java.nio.charset.StandardCharsets.US_ASCII;
import static java.util.Objects.requireNonNull;

/**
 * A session store that keeps the session in a signed cookie.<p>
 *
 * The cookie value is the Base64url-encoded JSON of the session, a dot, and
 * the Base64url-encoded HMAC-SHA256 of the encoded JSON. The session is not
 * encrypted; the client can read it but not change it.<p>
 *
 * A cookie that fails verification, or can not be decoded, is logged and
 * loads as an empty session.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class CookieSessionStore implements SessionStore
{
    private static final System.Logger LOG
            = System.getLogger(CookieSessionStore.class.getPackageName());

    /** The name of the cookie, unless specified. */
    public static final String DEFAULT_COOKIE_NAME = "_nomagicmvc_session";

    private static final String ALGORITHM = "HmacSHA256";
    private static final int MIN_SECRET_LENGTH = 32;
    private static final String ATTRIBUTES = "; Path=/; HttpOnly; SameSite=Lax";

    private static final Base64.Encoder ENC = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder DEC = Base64.getUrlDecoder();

    private final String cookieName;
    private final SecretKeySpec key;

    /**
     * Initializes this object, using the default cookie name.
     *
     * @param secret signing key, at least 32 bytes
     * @throws NullPointerException if {@code secret} is {@code null}
     * @throws IllegalArgumentException if {@code secret} is too short
     */
    public CookieSessionStore(byte[] secret) {
        this(DEFAULT_COOKIE_NAME, secret);
    }

    /**
     * Initializes this object.
     *
     * @param cookieName name of cookie
     * @param secret signing key, at least 32 bytes
     * @throws NullPointerException if any argument is {@code null}
     * @throws IllegalArgumentException
     *             if {@code cookieName} is empty, or
     *             if {@code secret} is too short
     */
    public CookieSessionStore(String cookieName, byte[] secret) {
        if (requireNonNull(cookieName, "cookieName").isEmpty()) {
            throw new IllegalArgumentException("Empty cookie name.");
        }
        if (requireNonNull(secret, "secret").length < MIN_SECRET_LENGTH) {
            throw new IllegalArgumentException(
                    "Secret must be at least " + MIN_SECRET_LENGTH + " bytes.");
        }
        this.cookieName = cookieName;
        this.key = new SecretKeySpec(secret.clone(), ALGORITHM);
    }

    /**
     * {@return the name of the cookie}
     */
    public String cookieName() {
        return cookieName;
    }

    @Override
    public Map<String, Object> load(Request request) {
        var val = request.cookie(cookieName);
        if (val.isEmpty()) {
            return new HashMap<>();
        }
        try {
            return decode(val.get());
        } catch (IOException | IllegalArgumentException e) {
            LOG.log(WARNING, "Rejected session cookie \"" + cookieName + "\": " + e.getMessage());
            return new HashMap<>();
        }
    }

    @Override
    public void save(Map<String, Object> session, Context ctx) {
        LOG.log(DEBUG, () -> "Saving session keys " + session.keySet());
        ctx.addRespHeader(SET_COOKIE, cookieName + "=" + encode(session) + ATTRIBUTES);
    }

    @Override
    public void drop(Context ctx) {
        ctx.addRespHeader(SET_COOKIE, cookieName + "=; Max-Age=0; Path=/");
    }

    /**
     * Encodes a session into a signed cookie value.
     *
     * @param session to encode
     * @return the cookie value
     * @throws IllegalArgumentException if a value can not be serialized
     */
    String encode(Map<String, Object> session) {
        String payload = ENC.encodeToString(Json.write(session));
        return payload + "." + ENC.encodeToString(sign(payload));
    }

    /**
     * Verifies and decodes a cookie value.
     *
     * @param value cookie value
     * @return the session
     * @throws IOException if the value is malformed or the signature is invalid
     * @throws IllegalArgumentException if a part is not valid Base64
     */
    Map<String, Object> decode(String value) throws IOException {
        int dot = value.lastIndexOf('.');
        if (dot <= 0 || dot == value.length() - 1) {
            throw new IOException("Malformed value.");
        }
        String payload = value.substring(0, dot);
        byte[] actual = DEC.decode(value.substring(dot + 1));
        if (!MessageDigest.isEqual(sign(payload), actual)) {
            throw new IOException("Invalid signature.");
        }
        return Json.readMap(DEC.decode(payload));
    }

    private byte[] sign(String payload) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(key);
            return mac.doFinal(payload.getBytes(US_ASCII));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException(ALGORITHM + " unavailable.", e);
        }
    }
}
