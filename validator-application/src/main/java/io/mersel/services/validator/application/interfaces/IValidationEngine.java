package io.mersel.services.validator.application.interfaces;

import io.mersel.services.validator.application.models.Violation;

import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Kural değerlendirmesini yapan doğrulama motoru arayüzü.
 * <p>
 * Her çağrı ihlal kayıtlarının sıralı listesini döner (boş liste = geçerli).
 * Bir kural ihlali olmayan motor hataları (bean olmayan değer, bilinmeyen kural,
 * bozuk kural ifadesi) {@link RuntimeException} olarak fırlatılır.
 */
public interface IValidationEngine {

    List<Violation> validateStruct(Object value);

    List<Violation> validateStructExcept(Object value, Collection<String> excludedFields);

    List<Violation> validateStructPartial(Object value, Collection<String> includedFields);

    List<Violation> validateVar(Object value, String ruleExpression);

    List<Violation> validateVarWithValue(Object value, Object other, String ruleExpression);

    /**
     * Özel kural kaydeder. Aynı adla kayıtlı kural varsa üzerine yazılır.
     */
    void registerRule(String rule, RulePredicate predicate);

    /**
     * Kayıtlı tüm kural adları.
     */
    Set<String> getRuleNames();
}
