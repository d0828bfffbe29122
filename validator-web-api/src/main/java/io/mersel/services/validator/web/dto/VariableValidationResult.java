package io.mersel.services.validator.web.dto;

import io.mersel.services.validator.application.models.ValidationErrors;

import java.util.Map;

/**
 * Doğrulama sonucu.
 *
 * @param valid  Hiç kural ihlali yoksa {@code true}
 * @param locale Mesajların üretildiği dil etiketi
 * @param errors Alan → kural → mesaj
 */
public record VariableValidationResult(
        boolean valid,
        String locale,
        Map<String, Map<String, String>> errors
) {

    public static VariableValidationResult of(String locale, ValidationErrors errors) {
        return new VariableValidationResult(!errors.hasValidationErrors(), locale, errors.getErrors());
    }
}
