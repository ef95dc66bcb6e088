package alpha.nomagicmvc;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.lang.reflect.Field;
import java.util.Set;
import java.util.stream.Collectors;

import static alpha.nomagicmvc.HttpConstants.ReasonPhrase;
import static alpha.nomagicmvc.HttpConstants.StatusCode;
import static java.lang.reflect.Modifier.isPublic;
import static java.lang.reflect.Modifier.isStatic;
import static java.util.Arrays.stream;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Small tests for {@link HttpConstants}.<p>
 * 
 * Every status code constant must be recognized and have a reason phrase,
 * and every symbolic name must translate back into its code.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
class HttpConstantsTest
{
    @Test
    void every_constant_is_recognized() {
        for (int code : constants()) {
            assertTrue(StatusCode.isRecognized(code), () -> "Unrecognized: " + code);
            assertThat(StatusCode.reasonPhrase(code)).isPresent();
        }
    }
    
    @Test
    void unknown_codes() {
        assertFalse(StatusCode.isRecognized(299));
        assertFalse(StatusCode.isRecognized(1_000));
        assertThat(StatusCode.reasonPhrase(299)).isEmpty();
    }
    
    @ParameterizedTest
    @CsvSource({
        "ok,                     200",
        "not_found,              404",
        "NOT_FOUND,              404",
        "unprocessable_entity,   422",
        "im_a_teapot,            418",
        "internal_server_error,  500",
        "found,                  302" })
    void fromName(String name, int expected) {
        assertThat(StatusCode.fromName(name)).hasValue(expected);
    }
    
    @Test
    void fromName_unknown() {
        assertThat(StatusCode.fromName("not_a_status")).isEmpty();
        assertThat(StatusCode.fromName("")).isEmpty();
    }
    
    @Test
    void classes() {
        assertTrue(StatusCode.isRedirection(302));
        assertFalse(StatusCode.isRedirection(200));
        assertTrue(StatusCode.isClientError(406));
        assertFalse(StatusCode.isClientError(500));
        assertTrue(StatusCode.isServerError(500));
        assertFalse(StatusCode.isServerError(499));
    }
    
    @Test
    void reasonPhrase() {
        assertThat(StatusCode.reasonPhrase(404)).hasValue(ReasonPhrase.NOT_FOUND);
        assertEquals("Not Found", ReasonPhrase.NOT_FOUND);
    }
    
    private static Set<Integer> constants() {
        return stream(StatusCode.class.getFields())
                .filter(f -> f.getType() == int.class &&
                             isStatic(f.getModifiers()) &&
                             isPublic(f.getModifiers()))
                .map(HttpConstantsTest::get)
                .collect(Collectors.toSet());
    }
    
    private static int get(Field f) {
        try {
            return f.getInt(null);
        } catch (IllegalAccessException e) {
            throw new AssertionError(e);
        }
    }
}
