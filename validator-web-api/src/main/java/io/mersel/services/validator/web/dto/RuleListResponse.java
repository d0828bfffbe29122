package io.mersel.services.validator.web.dto;

import java.util.List;

/**
 * Kayıtlı kurallar yanıtı.
 */
public record RuleListResponse(int count, List<String> rules) {
}
