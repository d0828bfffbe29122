package io.mersel.services.validator.infrastructure.translation;

import io.mersel.services.validator.application.enums.PluralCategory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("PluralRules")
class PluralRulesTest {

    @Test
    @DisplayName("ingilizce — one for 1, other otherwise")
    void ingilizce() {
        var rules = PluralRules.forLocale("en-US");

        assertThat(rules.select(1)).isEqualTo(PluralCategory.ONE);
        assertThat(rules.select(0)).isEqualTo(PluralCategory.OTHER);
        assertThat(rules.select(5)).isEqualTo(PluralCategory.OTHER);
    }

    @Test
    @DisplayName("farsca — zero and one share ONE")
    void farsca() {
        var rules = PluralRules.forLocale("fa_IR");

        assertThat(rules.select(0)).isEqualTo(PluralCategory.ONE);
        assertThat(rules.select(1)).isEqualTo(PluralCategory.ONE);
        assertThat(rules.select(2)).isEqualTo(PluralCategory.OTHER);
    }

    @Test
    @DisplayName("arapca — six categories")
    void arapca() {
        var rules = PluralRules.forLocale("ar");

        assertThat(rules.select(0)).isEqualTo(PluralCategory.ZERO);
        assertThat(rules.select(1)).isEqualTo(PluralCategory.ONE);
        assertThat(rules.select(2)).isEqualTo(PluralCategory.TWO);
        assertThat(rules.select(5)).isEqualTo(PluralCategory.FEW);
        assertThat(rules.select(11)).isEqualTo(PluralCategory.MANY);
        assertThat(rules.select(100)).isEqualTo(PluralCategory.OTHER);
    }

    @Test
    @DisplayName("rusca — one / few / many by last digits")
    void rusca() {
        var rules = PluralRules.forLocale("ru");

        assertThat(rules.select(1)).isEqualTo(PluralCategory.ONE);
        assertThat(rules.select(21)).isEqualTo(PluralCategory.ONE);
        assertThat(rules.select(3)).isEqualTo(PluralCategory.FEW);
        assertThat(rules.select(12)).isEqualTo(PluralCategory.MANY);
        assertThat(rules.select(25)).isEqualTo(PluralCategory.MANY);
    }

    @Test
    @DisplayName("bilinmeyen — unknown or blank locale uses one/other")
    void bilinmeyen() {
        assertThat(PluralRules.forLocale("xx").select(1)).isEqualTo(PluralCategory.ONE);
        assertThat(PluralRules.forLocale("").select(2)).isEqualTo(PluralCategory.OTHER);
        assertThat(PluralRules.forLocale(null).select(1)).isEqualTo(PluralCategory.ONE);
    }
}
