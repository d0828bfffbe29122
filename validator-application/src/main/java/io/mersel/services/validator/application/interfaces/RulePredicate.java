package io.mersel.services.validator.application.interfaces;

import io.mersel.services.validator.application.models.RuleContext;

/**
 * Adlandırılmış bir doğrulama kuralının fonksiyonu.
 */
@FunctionalInterface
public interface RulePredicate {

    /**
     * @return değer kuralı sağlıyorsa {@code true}
     */
    boolean test(RuleContext context);
}
