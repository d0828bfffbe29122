package io.mersel.services.validator.application.models;

/**
 * Sayısal dönüşüm sonrası kural parametresi.
 *
 * @param value {@link Long}, {@link Double} veya sayısal olmayan orijinal {@link String}
 * @param count Çoğul biçim seçimi için kullanılan sayı (sayısal değilse 0)
 */
public record NumericParam(Object value, int count) {

    public boolean isNumeric() {
        return value instanceof Number;
    }
}
