package io.mersel.services.validator.application.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import io.mersel.services.validator.application.interfaces.UnknownRuleException;

/**
 * Doğrulama endpoint'lerinin yanıt zarfı.
 * <p>
 * Kural ihlalleri başarılı bir sonuçtur ve {@code result} içinde döner.
 * Doğrulamanın hiç yapılamadığı durumlarda {@code result} boştur,
 * {@code errorCode} nedeni makine tarafından okunabilir biçimde verir:
 * <ul>
 *   <li>{@value #UNKNOWN_RULE}: kural ifadesinde kayıtlı olmayan kural</li>
 *   <li>{@value #ENGINE_FAILURE}: bozuk ifade, geçersiz parametre veya çeviri hatası</li>
 * </ul>
 *
 * @param result       Doğrulama sonucu
 * @param errorCode    Hata kodu; başarılı yanıtlarda {@code null}
 * @param errorMessage Hata açıklaması; başarılı yanıtlarda {@code null}
 * @param <T>          Sonuç tipi
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ValidationServiceResponse<T>(T result, String errorCode, String errorMessage) {

    public static final String UNKNOWN_RULE = "unknown_rule";
    public static final String ENGINE_FAILURE = "engine_failure";

    public static <T> ValidationServiceResponse<T> success(T result) {
        return new ValidationServiceResponse<>(result, null, null);
    }

    /**
     * Kayıtlı olmayan kural adı için hata yanıtı.
     */
    public static <T> ValidationServiceResponse<T> unknownRule(String rule) {
        return failure(new UnknownRuleException(rule));
    }

    /**
     * {@link ValidationErrors#getInternalError()} ile taşınan hatadan yanıt üretir.
     */
    public static <T> ValidationServiceResponse<T> failure(Throwable internalError) {
        String code = internalError instanceof UnknownRuleException ? UNKNOWN_RULE : ENGINE_FAILURE;
        return new ValidationServiceResponse<>(null, code, internalError.getMessage());
    }

    @JsonIgnore
    public boolean isFailure() {
        return errorCode != null;
    }
}
