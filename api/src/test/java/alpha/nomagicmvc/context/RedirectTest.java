package alpha.nomagicmvc.context;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RedirectTest
{
    @Test
    void to() {
        var r = Redirect.to("/users?page=2");
        assertThat(r.location()).isEqualTo("/users?page=2");
        assertThat(r.isExternal()).isFalse();
    }
    
    @Test
    void external() {
        var r = Redirect.external("https://example.com/login");
        assertThat(r.location()).isEqualTo("https://example.com/login");
        assertThat(r.isExternal()).isTrue();
    }
    
    @ParameterizedTest
    @ValueSource(strings = {
        "https://evil.com/",
        "//evil.com/path",
        "users",
        "" })
    void to_rejects(String location) {
        assertThatThrownBy(() -> Redirect.to(location))
                .isExactlyInstanceOf(IllegalRedirectException.class);
    }
    
    @ParameterizedTest
    @ValueSource(strings = {
        "/users",
        "example.com/users",
        "mailto:someone@example.com",
        "http://bad host/" })
    void external_rejects(String location) {
        assertThatThrownBy(() -> Redirect.external(location))
                .isExactlyInstanceOf(IllegalRedirectException.class);
    }
    
    @Test
    void illegalRedirect_isIllegalArgument() {
        assertThatThrownBy(() -> Redirect.to("http://x.org"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("Expected a path, got a URL");
    }
}
