package io.mersel.services.validator.infrastructure.engine;

import io.mersel.services.validator.infrastructure.rules.RuleRegistry;
import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorFactory;

/**
 * {@link RuleConstraintValidator} örneklerine kayıt defterini enjekte eder,
 * diğer tüm doğrulayıcıları varsayılan fabrikaya devreder.
 */
class RuleAwareConstraintValidatorFactory implements ConstraintValidatorFactory {

    private final ConstraintValidatorFactory delegate;
    private final RuleRegistry registry;

    RuleAwareConstraintValidatorFactory(ConstraintValidatorFactory delegate, RuleRegistry registry) {
        this.delegate = delegate;
        this.registry = registry;
    }

    @Override
    public <T extends ConstraintValidator<?, ?>> T getInstance(Class<T> key) {
        if (key == RuleConstraintValidator.class) {
            return key.cast(new RuleConstraintValidator(registry));
        }
        return delegate.getInstance(key);
    }

    @Override
    public void releaseInstance(ConstraintValidator<?, ?> instance) {
        if (!(instance instanceof RuleConstraintValidator)) {
            delegate.releaseInstance(instance);
        }
    }
}
