package io.mersel.services.validator.application.interfaces;

/**
 * Doğrulanan değerin alan başlıklarını kendisinin çevirebilmesi için opsiyonel yetenek.
 */
public interface TranslatableField {

    /**
     * @return Alanın gösterim adı veya çevrilemiyorsa boş string
     */
    String translateTitle(String locale, String field);
}
