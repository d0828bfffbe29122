package io.mersel.services.validator.infrastructure.diagnostics;

import io.mersel.services.validator.application.interfaces.IValidationEngine;
import io.mersel.services.validator.infrastructure.translation.CatalogTranslator;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

import java.util.TreeSet;

/**
 * Doğrulama motoru sağlık kontrolü.
 * <p>
 * Motorun çalışır durumda olduğunu basit bir {@code required} değerlendirmesi ile doğrular.
 */
public class ValidatorHealthCheck implements HealthIndicator {

    private final IValidationEngine engine;
    private final CatalogTranslator translator;

    public ValidatorHealthCheck(IValidationEngine engine, CatalogTranslator translator) {
        this.engine = engine;
        this.translator = translator;
    }

    @Override
    public Health health() {
        try {
            if (!engine.validateVar("probe", "required").isEmpty()) {
                return Health.down()
                        .withDetail("engine", "Hibernate Validator")
                        .withDetail("error", "Deneme doğrulaması beklenmeyen ihlal üretti")
                        .build();
            }

            return Health.up()
                    .withDetail("engine", "Hibernate Validator")
                    .withDetail("rules", engine.getRuleNames().size())
                    .withDetail("locales", new TreeSet<>(translator.getLocales()))
                    .withDetail("fallbackLocale", translator.getFallbackLocale())
                    .build();

        } catch (RuntimeException e) {
            return Health.down()
                    .withDetail("engine", "Hibernate Validator")
                    .withDetail("error", e.getMessage())
                    .build();
        }
    }
}
