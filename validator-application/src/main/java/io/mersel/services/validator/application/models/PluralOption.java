package io.mersel.services.validator.application.models;

import io.mersel.services.validator.application.enums.PluralCategory;

import java.util.Objects;

/**
 * Bir mesajın belirli bir çoğul kategorisi için alternatif şablonu.
 *
 * @param category CLDR çoğul kategorisi
 * @param template Bu kategori seçildiğinde kullanılacak şablon
 */
public record PluralOption(PluralCategory category, String template) {

    public PluralOption {
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(template, "template");
    }

    public static PluralOption zero(String template) {
        return new PluralOption(PluralCategory.ZERO, template);
    }

    public static PluralOption one(String template) {
        return new PluralOption(PluralCategory.ONE, template);
    }

    public static PluralOption two(String template) {
        return new PluralOption(PluralCategory.TWO, template);
    }

    public static PluralOption few(String template) {
        return new PluralOption(PluralCategory.FEW, template);
    }

    public static PluralOption many(String template) {
        return new PluralOption(PluralCategory.MANY, template);
    }

    public static PluralOption other(String template) {
        return new PluralOption(PluralCategory.OTHER, template);
    }
}
