package io.mersel.services.validator.infrastructure.engine;

import io.mersel.services.validator.application.constraints.Rule;
import io.mersel.services.validator.application.models.RuleContext;
import io.mersel.services.validator.infrastructure.rules.BuiltinRules;
import io.mersel.services.validator.infrastructure.rules.RuleRegistry;
import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

/**
 * {@link Rule} kısıtını kural kayıt defterindeki fonksiyona bağlayan doğrulayıcı.
 * <p>
 * Kural adı doğrulama anında çözülür; kayıtlı olmayan kural
 * {@link io.mersel.services.validator.application.interfaces.UnknownRuleException} fırlatır.
 * Alan karşılaştırma kuralları ({@code eqfield}, {@code nefield}) kardeş alana
 * erişemediği için burada geçer sayılır ve {@link FieldComparisons} ile değerlendirilir.
 */
class RuleConstraintValidator implements ConstraintValidator<Rule, Object> {

    private final RuleRegistry registry;
    private String rule;
    private String param;

    RuleConstraintValidator(RuleRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void initialize(Rule annotation) {
        this.rule = annotation.value();
        this.param = annotation.param();
    }

    @Override
    public boolean isValid(Object value, ConstraintValidatorContext context) {
        if (BuiltinRules.FIELD_COMPARISON_RULES.contains(rule)) {
            return true;
        }
        return registry.get(rule).test(RuleContext.of(value, param));
    }
}
