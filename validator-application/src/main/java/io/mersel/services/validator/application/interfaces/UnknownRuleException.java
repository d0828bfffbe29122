package io.mersel.services.validator.application.interfaces;

/**
 * Kayıtlı olmayan bir kural adı kullanıldığında fırlatılır.
 */
public class UnknownRuleException extends ValidationEngineException {

    private final String rule;

    public UnknownRuleException(String rule) {
        super("Tanımsız doğrulama kuralı: '" + rule + "'");
        this.rule = rule;
    }

    public String getRule() {
        return rule;
    }
}
