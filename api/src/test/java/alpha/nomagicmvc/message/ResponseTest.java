package alpha.nomagicmvc.message;

import org.junit.jupiter.api.Test;

import static alpha.nomagicmvc.HttpConstants.HeaderName.CONTENT_TYPE;
import static alpha.nomagicmvc.HttpConstants.HeaderName.LOCATION;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertSame;

/**
 * Small tests of {@link Response} and {@link Responses}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
class ResponseTest
{
    @Test
    void defaultReasonPhrase() {
        assertThat(Response.builder(404).build().reasonPhrase()).isEqualTo("Not Found");
        assertThat(Response.builder(299).build().reasonPhrase()).isEqualTo("Unknown");
    }
    
    @Test
    void statusCodeResetsPhrase() {
        var rsp = Response.builder(200).reasonPhrase("Fine")
                          .statusCode(404).build();
        assertThat(rsp.reasonPhrase()).isEqualTo("Not Found");
    }
    
    @Test
    void headerReplacesAddHeaderAppends() {
        var rsp = Response.builder(200)
                .addHeader("X-A", "1")
                .addHeader("x-a", "2")
                .header("X-B", "1")
                .header("X-B", "2")
                .build();
        assertThat(rsp.headers().get("X-A")).containsExactly("1", "2");
        assertThat(rsp.headers().get("x-b")).containsExactly("2");
        assertThat(rsp.toBuilder().removeHeader("X-A").build().header("X-A")).isEmpty();
    }
    
    @Test
    void bodyIsCopied() {
        byte[] b = "hello".getBytes(UTF_8);
        var rsp = Response.builder(200).body(b).build();
        b[0] = 'j';
        assertThat(rsp.bodyAsString()).isEqualTo("hello");
        rsp.body()[0] = 'j';
        assertThat(rsp.bodyAsString()).isEqualTo("hello");
    }
    
    @Test
    void noContentWithBody() {
        assertThatThrownBy(() -> Response.builder(204).body(new byte[1]).build())
                .isExactlyInstanceOf(IllegalStateException.class);
    }
    
    @Test
    void responses() {
        assertSame(Responses.ok(), Responses.status(200));
        assertThat(Responses.notAcceptable().statusCode()).isEqualTo(406);
        
        var text = Responses.text("hi");
        assertThat(text.header(CONTENT_TYPE)).hasValue("text/plain; charset=utf-8");
        assertThat(text.bodyAsString()).isEqualTo("hi");
        
        var found = Responses.found("/users");
        assertThat(found.isRedirection()).isTrue();
        assertThat(found.header(LOCATION)).hasValue("/users");
    }
}
