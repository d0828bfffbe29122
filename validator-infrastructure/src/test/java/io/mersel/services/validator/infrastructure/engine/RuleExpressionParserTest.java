package io.mersel.services.validator.infrastructure.engine;

import io.mersel.services.validator.application.interfaces.ValidationEngineException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("RuleExpressionParser")
class RuleExpressionParserTest {

    @Test
    @DisplayName("ayristirma — names and params in order")
    void ayristirma() {
        assertThat(RuleExpressionParser.parse("required, min=3 ,oneof=a b c"))
                .containsExactly(
                        new RuleCall("required", ""),
                        new RuleCall("min", "3"),
                        new RuleCall("oneof", "a b c"));
    }

    @Test
    @DisplayName("kacis — 0x2C and 0x7C become comma and pipe")
    void kacis() {
        assertThat(RuleExpressionParser.parse("oneof=a0x2Cb0x7Cc"))
                .containsExactly(new RuleCall("oneof", "a,b|c"));
    }

    @Test
    @DisplayName("parametrede_esittir — only the first '=' splits")
    void parametrede_esittir() {
        assertThat(RuleExpressionParser.parse("eq=a=b")).containsExactly(new RuleCall("eq", "a=b"));
    }

    @Test
    @DisplayName("bos_ifade — no rules")
    void bos_ifade() {
        assertThat(RuleExpressionParser.parse("")).isEmpty();
        assertThat(RuleExpressionParser.parse("   ")).isEmpty();
        assertThat(RuleExpressionParser.parse(null)).isEmpty();
    }

    @Test
    @DisplayName("bos_segment — engine error")
    void bos_segment() {
        assertThatThrownBy(() -> RuleExpressionParser.parse("required,,min=3"))
                .isInstanceOf(ValidationEngineException.class);
        assertThatThrownBy(() -> RuleExpressionParser.parse("=3"))
                .isInstanceOf(ValidationEngineException.class);
    }
}
