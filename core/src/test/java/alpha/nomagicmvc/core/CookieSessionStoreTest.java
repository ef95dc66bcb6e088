package alpha.nomagicmvc.core;

import alpha.nomagicmvc.context.Context;
import alpha.nomagicmvc.message.Request;
import alpha.nomagicmvc.testutil.LogRecorder;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Map;

import static alpha.nomagicmvc.HttpConstants.HeaderName.COOKIE;
import static alpha.nomagicmvc.HttpConstants.HeaderName.SET_COOKIE;
import static alpha.nomagicmvc.HttpConstants.Method.GET;
import static java.lang.System.Logger.Level.WARNING;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

/**
 * Tests of {@link CookieSessionStore}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
class CookieSessionStoreTest
{
    private static final byte[] SECRET
            = "0123456789abcdef0123456789abcdef".getBytes(UTF_8);
    
    private final CookieSessionStore testee = new CookieSessionStore(SECRET);
    
    private String saved(Map<String, Object> session) {
        var ctx = mock(Context.class);
        testee.save(session, ctx);
        var header = ArgumentCaptor.forClass(String.class);
        verify(ctx).addRespHeader(eq(SET_COOKIE), header.capture());
        return header.getValue();
    }
    
    private static Request withCookie(String cookie) {
        return Request.builder(GET, "/").header(COOKIE, cookie).build();
    }
    
    @Test
    void roundTrip() {
        var setCookie = saved(Map.of("user_id", 42, "roles", List.of("admin")));
        assertThat(setCookie)
                .startsWith("_nomagicmvc_session=")
                .endsWith("; Path=/; HttpOnly; SameSite=Lax");
        
        var pair = setCookie.substring(0, setCookie.indexOf(';'));
        var session = testee.load(withCookie("theme=dark; " + pair));
        assertThat(session).containsOnly(
                Map.entry("user_id", 42),
                Map.entry("roles", List.of("admin")));
    }
    
    @Test
    void noCookie() {
        assertThat(testee.load(Request.builder(GET, "/").build())).isEmpty();
    }
    
    @Test
    void loadedSessionIsMutable() {
        var session = testee.load(Request.builder(GET, "/").build());
        session.put("k", "v");
        assertThat(session).containsEntry("k", "v");
    }
    
    @Test
    void tampered() {
        var log = LogRecorder.startRecording(CookieSessionStore.class);
        try {
            var value = testee.encode(Map.of("user_id", 1));
            var forged = testee.encode(Map.of("user_id", 2));
            // Signature of one, payload of the other
            var mixed = forged.substring(0, forged.indexOf('.')) +
                        value.substring(value.indexOf('.'));
            assertThat(testee.load(withCookie("_nomagicmvc_session=" + mixed))).isEmpty();
            log.assertRemove(WARNING,
                    "Rejected session cookie \"_nomagicmvc_session\": Invalid signature.");
        } finally {
            log.stopRecording();
        }
    }
    
    @Test
    void otherSecret() {
        var other = new CookieSessionStore("abcdefghijabcdefghijabcdefghij12".getBytes(UTF_8));
        var value = other.encode(Map.of("a", "b"));
        assertThatThrownBy(() -> testee.decode(value))
                .hasMessage("Invalid signature.");
    }
    
    @Test
    void malformed() {
        assertThatThrownBy(() -> testee.decode("nodot"))
                .hasMessage("Malformed value.");
        assertThatThrownBy(() -> testee.decode("trailing."))
                .hasMessage("Malformed value.");
    }
    
    @Test
    void drop() {
        var ctx = mock(Context.class);
        testee.drop(ctx);
        verify(ctx).addRespHeader(SET_COOKIE, "_nomagicmvc_session=; Max-Age=0; Path=/");
    }
    
    @Test
    void shortSecret() {
        assertThatThrownBy(() -> new CookieSessionStore(new byte[31]))
                .isExactlyInstanceOf(IllegalArgumentException.class)
                .hasMessage("Secret must be at least 32 bytes.");
    }
    
    @Test
    void emptyCookieName() {
        assertThatThrownBy(() -> new CookieSessionStore("", SECRET))
                .isExactlyInstanceOf(IllegalArgumentException.class)
                .hasMessage("Empty cookie name.");
    }
    
    @Test
    void customCookieName() {
        var store = new CookieSessionStore("sid", SECRET);
        assertThat(store.cookieName()).isEqualTo("sid");
    }
}
