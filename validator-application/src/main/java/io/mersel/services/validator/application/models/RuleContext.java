package io.mersel.services.validator.application.models;

/**
 * Kural fonksiyonuna verilen değerlendirme bağlamı.
 *
 * @param value Doğrulanan değer
 * @param param Kural parametresi (örn: "min=3" için "3"; yoksa boş string)
 * @param other Karşılaştırma değeri ({@code eqfield} gibi kurallar için; yoksa {@code null})
 */
public record RuleContext(Object value, String param, Object other) {

    public RuleContext {
        param = param != null ? param : "";
    }

    public static RuleContext of(Object value, String param) {
        return new RuleContext(value, param, null);
    }

    /**
     * Değerin string gösterimi; {@code null} için boş string.
     */
    public String valueAsString() {
        return value != null ? value.toString() : "";
    }
}
