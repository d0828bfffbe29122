package io.mersel.services.validator.web.controllers;

import io.mersel.services.validator.application.interfaces.IValidationEngine;
import io.mersel.services.validator.web.dto.RuleListResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Kayıtlı kuralları listeler.
 */
@RestController
@RequestMapping("/v1")
@Tag(name = "Rules", description = "Kayıtlı doğrulama kuralları")
public class RulesController {

    private final IValidationEngine engine;

    public RulesController(IValidationEngine engine) {
        this.engine = engine;
    }

    @Operation(summary = "Kural Listesi", description = "Yerleşik, format ve özel kuralların alfabetik listesi.")
    @GetMapping("/rules")
    public RuleListResponse listRules() {
        List<String> rules = List.copyOf(engine.getRuleNames());
        return new RuleListResponse(rules.size(), rules);
    }
}
