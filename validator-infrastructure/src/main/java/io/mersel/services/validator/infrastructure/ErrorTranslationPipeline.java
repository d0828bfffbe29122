package io.mersel.services.validator.infrastructure;

import io.mersel.services.validator.application.models.NumericParam;
import io.mersel.services.validator.application.models.TranslationContext;
import io.mersel.services.validator.application.models.ValidationErrors;
import io.mersel.services.validator.application.models.Violation;

import java.util.List;

/**
 * Motorun ihlal kayıtlarını tek bir {@link ValidationErrors} nesnesine dönüştürür.
 * <p>
 * Motor çağrısı burada yapılmaz; hat yalnızca hazır kayıtlar üzerinde çalışır.
 * Bean doğrulamada alan kimliği motorun bildirdiği alan adıdır. Değişken
 * doğrulamada çağıranın verdiği ad hem gösterim hem anahtar için kullanılır.
 * <p>
 * Çeviri boş dönerse (çevirmen yok, anahtar bulunamadı) motorun varsayılan
 * mesajı kaydedilir; her ihlal kaydı için mutlaka bir mesaj bulunur.
 */
public final class ErrorTranslationPipeline {

    private final TranslationResolver resolver;

    public ErrorTranslationPipeline(TranslationResolver resolver) {
        this.resolver = resolver;
    }

    public ValidationErrors translateStruct(String locale, Object value, List<Violation> violations) {
        var result = ValidationErrors.empty();
        if (violations == null) {
            return result;
        }

        for (Violation violation : violations) {
            result.addError(
                    violation.field(),
                    violation.rule(),
                    resolve(locale, violation.field(), violation.structField(), value, violation));
        }
        return result;
    }

    public ValidationErrors translateVariable(String locale, String name, Object value, List<Violation> violations) {
        var result = ValidationErrors.empty();
        if (violations == null) {
            return result;
        }

        String field = name != null ? name : "";
        for (Violation violation : violations) {
            result.addError(field, violation.rule(), resolve(locale, field, field, value, violation));
        }
        return result;
    }

    private String resolve(String locale, String displayName, String structField, Object value, Violation violation) {
        if (!resolver.hasTranslator()) {
            return violation.message();
        }

        NumericParam param = NumericCoercion.coerce(violation.param());
        String message = resolver.translate(new TranslationContext(
                locale, displayName, violation.rule(), structField, param.value(), value, param.count()));

        return message == null || message.isBlank() ? violation.message() : message;
    }
}
