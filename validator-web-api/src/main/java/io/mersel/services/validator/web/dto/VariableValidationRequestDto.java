package io.mersel.services.validator.web.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Tek değer doğrulama isteği DTO'su.
 * <p>
 * {@code other} yalnızca {@code eqfield} / {@code nefield} gibi karşılaştırma kuralları için gereklidir.
 */
public class VariableValidationRequestDto {

    @NotBlank(message = "Alan adı boş olamaz")
    @Size(max = 200)
    @Schema(description = "Hata kaydında ve mesajda kullanılacak alan adı",
            example = "mobile", requiredMode = Schema.RequiredMode.REQUIRED)
    private String name;

    @Schema(description = "Doğrulanacak değer (string, sayı, boolean veya dizi)", example = "09121234567", nullable = true)
    private Object value;

    @Schema(description = "Karşılaştırma değeri", nullable = true)
    private Object other;

    @NotBlank(message = "Kural ifadesi boş olamaz")
    @Size(max = 2000)
    @Schema(description = "Virgülle ayrılmış kural ifadesi. Parametre içinde virgül için 0x2C kullanın.",
            example = "required,mobile", requiredMode = Schema.RequiredMode.REQUIRED)
    private String rules;

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public Object getValue() {
        return value;
    }

    public void setValue(Object value) {
        this.value = value;
    }

    public Object getOther() {
        return other;
    }

    public void setOther(Object other) {
        this.other = other;
    }

    public String getRules() {
        return rules;
    }

    public void setRules(String rules) {
        this.rules = rules;
    }
}
