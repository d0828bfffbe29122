package io.mersel.services.validator.application.interfaces;

import io.mersel.services.validator.application.models.PluralOption;

import java.util.Map;

/**
 * Dil ve anahtar bazlı, çoğul biçim destekli mesaj çevirmeni.
 */
public interface ITranslator {

    /**
     * Mesajı verilen sayıya uygun çoğul biçimiyle biçimlendirir.
     *
     * @param locale Dil etiketi
     * @param key    Mesaj anahtarı
     * @param count  Çoğul biçim seçimi için kullanılan sayı
     * @param params Yer tutucu değerleri
     * @return Biçimlendirilmiş mesaj; anahtar bulunamazsa boş string
     */
    String plural(String locale, String key, int count, Map<String, Object> params);

    /**
     * Mesaj şablonu kaydeder. Aynı dil ve anahtar için önceki kayıt ezilir.
     */
    void addMessage(String locale, String key, String template, PluralOption... options);

    boolean hasMessage(String locale, String key);
}
