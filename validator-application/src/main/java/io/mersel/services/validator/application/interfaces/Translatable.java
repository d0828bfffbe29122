package io.mersel.services.validator.application.interfaces;

/**
 * Doğrulanan değerin kendi hata mesajını üretebilmesi için opsiyonel yetenek.
 * <p>
 * Boş olmayan bir sonuç dönerse genel çevirmen hiç çağrılmaz.
 */
public interface Translatable {

    /**
     * @param locale Dil etiketi
     * @param rule   Önek uygulanmamış kural adı
     * @param field  Java alan adı (değişken doğrulamada çağıranın verdiği ad)
     * @return Yerelleştirilmiş mesaj veya çevrilemiyorsa boş string
     */
    String translateError(String locale, String rule, String field);
}
