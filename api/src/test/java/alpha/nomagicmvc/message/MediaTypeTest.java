package alpha.nomagicmvc.message;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Map;

import static alpha.nomagicmvc.message.MediaType.ALL;
import static alpha.nomagicmvc.message.MediaType.TEXT_HTML;
import static alpha.nomagicmvc.message.MediaType.parse;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MediaTypeTest
{
    @Test
    void no_params_specific() {
        final String s = "text/plain";
        MediaType actual = parse(s);
        assertThat(actual).isEqualTo(new MediaType(s, "text", "plain", Map.of()));
        assertThat(actual.getClass()).isSameAs(MediaType.class);
        assertThat(actual.toString()).isEqualTo(s);
    }
    
    @Test
    void no_params_range() {
        final String s = "text/*";
        MediaType actual = parse(s);
        assertThat(actual).isEqualTo(new MediaRange(s, "text", "*", Map.of(), 1));
        assertThat(actual.getClass()).isSameAs(MediaRange.class);
        assertEquals(1, ((MediaRange) actual).quality());
    }
    
    @Test
    void one_param_range() {
        final String s = "  tExT/ * ; p=  123; q = 0.333";
        MediaType actual = parse(s);
        assertThat(actual).isEqualTo(new MediaRange(s, "text", "*", Map.of("p", "123"), 1 / 3d));
        assertThat(actual.getClass()).isSameAs(MediaRange.class);
        assertEquals(0.333, ((MediaRange) actual).quality());
        assertThat(actual.toString()).isEqualTo(s);
    }
    
    @Test
    void specific_type_with_quality_is_a_range() {
        MediaType actual = parse("application/json; q=0.5");
        assertThat(actual).isInstanceOf(MediaRange.class);
        assertEquals(0.5, ((MediaRange) actual).quality());
        // Quality has no effect on equality
        assertThat(actual).isEqualTo(parse("application/json"));
    }
    
    @Test
    void charset_of_text_is_lower_cased() {
        assertThat(parse("Text/HTML;Charset=\"UTF-8\""))
                .isEqualTo(parse("text/html; charset=utf-8"));
        // Not for other types
        assertThat(parse("application/x; charset=UTF-8").parameters())
                .containsEntry("charset", "UTF-8");
    }
    
    @Test
    void extension_params_ignored() {
        var actual = parse("*/*; q=0.2; ext=param");
        assertThat(actual.parameters()).isEmpty();
        assertThat(actual).isEqualTo(ALL);
    }
    
    @ParameterizedTest
    @ValueSource(strings = {
        "",
        "text",
        "text/html/x",
        " /html",
        "text/ ",
        "*/html",
        "text/html; charset",
        "text/html; charset=",
        "text/html; =utf-8",
        "text/html; a=1; a=2",
        "text/*; q=high" })
    void unparsable(String text) {
        assertThatThrownBy(() -> parse(text))
                .isExactlyInstanceOf(MediaTypeParseException.class)
                .hasMessageStartingWith("Can not parse \"" + text + "\".")
                .extracting(e -> ((MediaTypeParseException) e).getText())
                .isEqualTo(text);
    }
    
    @Test
    void includes() {
        // JavaDoc examples
        assertTrue(parse("text/*").includes(TEXT_HTML));
        assertTrue(TEXT_HTML.includes(parse("text/html; charset=utf-8")));
        assertFalse(parse("text/html; charset=utf-8").includes(TEXT_HTML));
        assertFalse(TEXT_HTML.includes(parse("text/plain")));
        
        assertTrue(ALL.includes(parse("application/json")));
        assertFalse(parse("application/*").includes(TEXT_HTML));
    }
    
    @Test
    void specificity() {
        assertEquals(5, parse("*/*").specificity());
        assertEquals(4, parse("*/*; a=b").specificity());
        assertEquals(3, parse("text/*").specificity());
        assertEquals(2, parse("text/*; a=b").specificity());
        assertEquals(1, parse("text/html").specificity());
        assertEquals(0, parse("text/html; a=b").specificity());
    }
    
    @Test
    void withCharsetUtf8() {
        var actual = TEXT_HTML.withCharsetUtf8();
        assertThat(actual.toString()).isEqualTo("text/html; charset=utf-8");
        assertThat(actual).isEqualTo(parse("text/html; charset=UTF-8"));
        // Idempotent
        assertThat(actual.withCharsetUtf8()).isSameAs(actual);
        assertNotEquals(TEXT_HTML, actual);
    }
}
