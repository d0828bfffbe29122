package io.mersel.services.validator.infrastructure.rules;

import io.mersel.services.validator.application.enums.FormatRule;
import io.mersel.services.validator.application.interfaces.UnknownRuleException;
import io.mersel.services.validator.application.interfaces.ValidationEngineException;
import io.mersel.services.validator.application.models.RuleContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * RuleRegistry ve yerleşik kural testleri.
 */
@DisplayName("RuleRegistry")
class RuleRegistryTest {

    private final RuleRegistry registry = RuleRegistry.withBuiltins();

    private boolean check(String rule, Object value, String param) {
        return registry.get(rule).test(RuleContext.of(value, param));
    }

    @Nested
    @DisplayName("Kayıt defteri")
    class Registry {

        @Test
        @DisplayName("yerlesik_kurallar — builtins registered and sorted")
        void yerlesik_kurallar() {
            assertThat(registry.names())
                    .contains("required", "min", "max", "len", "eq", "ne", "gt", "gte", "lt", "lte",
                            "oneof", "email", "eqfield", "nefield", "alpha", "numeric");
            assertThat(List.copyOf(registry.names())).isSorted();
        }

        @Test
        @DisplayName("uzerine_yazma — re-registering replaces the predicate")
        void uzerine_yazma() {
            registry.register("custom", ctx -> false);
            registry.register(" custom ", ctx -> true);

            assertThat(check("custom", "x", "")).isTrue();
        }

        @Test
        @DisplayName("bos_ad — blank rule name rejected")
        void bos_ad() {
            assertThatThrownBy(() -> registry.register(" ", ctx -> true))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("bilinmeyen — get throws UnknownRuleException, find is empty")
        void bilinmeyen() {
            assertThat(registry.find("nope")).isEmpty();
            assertThat(registry.contains("nope")).isFalse();
            assertThatThrownBy(() -> registry.get("nope"))
                    .isInstanceOf(UnknownRuleException.class)
                    .hasMessageContaining("nope");
        }
    }

    @Nested
    @DisplayName("Yerleşik kurallar")
    class Builtins {

        @Test
        @DisplayName("required — zero is present, empty values are not")
        void required() {
            assertThat(check("required", "a", "")).isTrue();
            assertThat(check("required", 0, "")).isTrue();
            assertThat(check("required", "", "")).isFalse();
            assertThat(check("required", null, "")).isFalse();
            assertThat(check("required", List.of(), "")).isFalse();
            assertThat(check("required", Map.of(), "")).isFalse();
            assertThat(check("required", new int[0], "")).isFalse();
        }

        @Test
        @DisplayName("boyut — strings by code point, numbers by value, collections by size")
        void boyut() {
            assertThat(check("min", "abc", "3")).isTrue();
            assertThat(check("min", "ab", "3")).isFalse();
            assertThat(check("max", "سلام", "4")).isTrue();
            assertThat(check("len", "😀😀", "2")).isTrue();
            assertThat(check("gt", 10, "5")).isTrue();
            assertThat(check("gte", 5.0, "5")).isTrue();
            assertThat(check("lt", List.of(1, 2), "3")).isTrue();
            assertThat(check("lte", new String[]{"a", "b", "c"}, "2")).isFalse();
            assertThat(check("min", null, "1")).isFalse();
        }

        @Test
        @DisplayName("boyut_hatali_parametre — non-numeric param is an engine error")
        void boyut_hatali_parametre() {
            assertThatThrownBy(() -> check("min", "abc", "x"))
                    .isInstanceOf(ValidationEngineException.class);
        }

        @Test
        @DisplayName("boyut_desteklenmeyen_tip — unsupported type is an engine error")
        void boyut_desteklenmeyen_tip() {
            assertThatThrownBy(() -> check("min", new Object(), "1"))
                    .isInstanceOf(ValidationEngineException.class);
        }

        @Test
        @DisplayName("eq_ne_oneof — string and numeric comparisons")
        void eq_ne_oneof() {
            assertThat(check("eq", "abc", "abc")).isTrue();
            assertThat(check("eq", 3, "3")).isTrue();
            assertThat(check("ne", "abc", "abd")).isTrue();
            assertThat(check("oneof", "red", "red green blue")).isTrue();
            assertThat(check("oneof", "pink", "red green blue")).isFalse();
        }

        @Test
        @DisplayName("eqfield — numeric-aware equality with other value")
        void eqfield() {
            var eqfield = registry.get("eqfield");

            assertThat(eqfield.test(new RuleContext(5, "", 5L))).isTrue();
            assertThat(eqfield.test(new RuleContext("a", "", "a"))).isTrue();
            assertThat(eqfield.test(new RuleContext("a", "", "b"))).isFalse();
            assertThat(registry.get("nefield").test(new RuleContext("a", "", "b"))).isTrue();
        }

        @Test
        @DisplayName("email_alpha_numeric — pattern based rules")
        void email_alpha_numeric() {
            assertThat(check("email", "ali@mersel.io", "")).isTrue();
            assertThat(check("email", "ali@", "")).isFalse();
            assertThat(check("alpha", "abc", "")).isTrue();
            assertThat(check("alpha", "abc1", "")).isFalse();
            assertThat(check("numeric", "-12.5", "")).isTrue();
            assertThat(check("numeric", "12a", "")).isFalse();
        }
    }

    @Test
    @DisplayName("format_kurallari — every FormatRule maps to a predicate")
    void format_kurallari() {
        for (FormatRule rule : FormatRule.values()) {
            assertThat(FormatRules.predicateFor(rule)).as(rule.name()).isNotNull();
        }
        assertThat(FormatRules.predicateFor(FormatRule.IRANIAN_NATIONAL_CODE)
                .test(RuleContext.of("0499370899", ""))).isTrue();
        assertThat(FormatRules.predicateFor(FormatRule.ALPHA_NUMERIC)
                .test(RuleContext.of("ab-c", "-"))).isTrue();
        assertThat(FormatRules.predicateFor(FormatRule.JALAALI)
                .test(RuleContext.of("1402/01/15", "uuuu/MM/dd"))).isTrue();
    }
}
