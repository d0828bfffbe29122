package io.mersel.services.validator.application.interfaces;

/**
 * Doğrulama motoru bir kural ihlali dışındaki bir nedenle çalışamadığında fırlatılır.
 * <p>
 * Bean olmayan değer, boş kural ifadesi veya motor yapılandırma hataları bu sınıftadır.
 */
public class ValidationEngineException extends RuntimeException {

    public ValidationEngineException(String message) {
        super(message);
    }

    public ValidationEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
