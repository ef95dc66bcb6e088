package alpha.nomagicmvc.context;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Small tests of {@link Status}.<p>
 * 
 * Creating a status never fails. Only resolving the code does.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
class StatusTest
{
    @Test
    void numeric() {
        var s = Status.of(201);
        assertThat(s.code()).isEqualTo(201);
        assertThat(s.isSymbolic()).isFalse();
        assertThat(s).hasToString("201");
    }
    
    @Test
    void symbolic() {
        var s = Status.of("unprocessable_entity");
        assertThat(s.code()).isEqualTo(422);
        assertThat(s.isSymbolic()).isTrue();
        assertThat(s).hasToString("unprocessable_entity");
    }
    
    @Test
    void unrecognized_numeric() {
        var s = Status.of(299);
        assertThatThrownBy(s::code)
                .isExactlyInstanceOf(InvalidStatusException.class)
                .hasMessage("Unrecognized status: \"299\"");
    }
    
    @Test
    void unrecognized_symbolic() {
        var s = Status.of("not_a_status");
        assertThatThrownBy(s::code)
                .isExactlyInstanceOf(InvalidStatusException.class)
                .hasMessage("Unrecognized status: \"not_a_status\"");
    }
}
