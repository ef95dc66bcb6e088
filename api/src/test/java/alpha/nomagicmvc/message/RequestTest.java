package alpha.nomagicmvc.message;

import org.junit.jupiter.api.Test;

import static alpha.nomagicmvc.HttpConstants.HeaderName.ACCEPT;
import static alpha.nomagicmvc.HttpConstants.HeaderName.COOKIE;
import static alpha.nomagicmvc.HttpConstants.Method.GET;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Small tests of {@link Request}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
class RequestTest
{
    @Test
    void builderIsImmutable() {
        var base = Request.builder(GET, "/users");
        var one = base.param("page", "1").build();
        var two = base.build();
        assertThat(one.param("page")).hasValue("1");
        assertThat(two.params()).isEmpty();
        assertThat(two.path()).isEqualTo("/users");
        assertThat(two.method()).isEqualTo(GET);
    }
    
    @Test
    void headersAreCaseInsensitive() {
        var req = Request.builder(GET, "/")
                .header("accept", "text/html")
                .header("ACCEPT", "application/json")
                .build();
        assertThat(req.headers().get(ACCEPT))
                .containsExactly("text/html", "application/json");
        assertThat(req.header("Accept")).hasValue("text/html");
        assertThat(req.header("X-Missing")).isEmpty();
    }
    
    @Test
    void cookie() {
        var req = Request.builder(GET, "/")
                .header(COOKIE, "a=1; b=\"two\"")
                .header(COOKIE, "c=3")
                .build();
        assertThat(req.cookie("a")).hasValue("1");
        assertThat(req.cookie("b")).hasValue("two");
        assertThat(req.cookie("c")).hasValue("3");
        assertThat(req.cookie("A")).isEmpty();
        assertThat(Request.builder(GET, "/").build().cookie("a")).isEmpty();
    }
    
    @Test
    void pathMustStartWithSlash() {
        assertThatThrownBy(() -> Request.builder(GET, "users"))
                .isExactlyInstanceOf(IllegalArgumentException.class)
                .hasMessage("Path must start with a forward slash: users");
    }
}
