package io.mersel.services.validator.application.interfaces;

import io.mersel.services.validator.application.models.PluralOption;
import io.mersel.services.validator.application.models.ValidationErrors;

/**
 * Yerelleştirilmiş doğrulama servisi arayüzü.
 * <p>
 * Doğrulamayı {@link IValidationEngine}'e devreder, motorun ürettiği ihlal
 * kayıtlarını istenen dile çevrilmiş {@link ValidationErrors} nesnesine dönüştürür.
 * <p>
 * Beklenen doğrulama hataları asla istisna olarak fırlatılmaz. Motorun kendisi
 * başarısız olursa (geçersiz kural ifadesi, bean olmayan değer vb.) hata
 * {@link ValidationErrors#getInternalError()} üzerinden taşınır.
 */
public interface ILocalizedValidator {

    /**
     * Özel bir doğrulama kuralı kaydeder. Boş kural adları yok sayılır.
     *
     * @param rule      Kural adı (örn: "is_valid")
     * @param predicate Kuralın doğrulama fonksiyonu
     */
    void addValidation(String rule, RulePredicate predicate);

    /**
     * Bir kural için belirtilen dilde mesaj şablonu kaydeder.
     * <p>
     * Yapılandırılmış bir önek varsa anahtar {@code önek.kural} olarak saklanır.
     * Çevirmen yapılandırılmamışsa veya kural adı boşsa işlem yapılmaz.
     *
     * @param locale   Dil etiketi (örn: "en", "fa"; boş = kök katalog)
     * @param rule     Kural adı
     * @param template Mesaj şablonu ({@code {field}}, {@code {param}} yer tutucuları)
     * @param options  Çoğul biçim seçenekleri
     */
    void addTranslation(String locale, String rule, String template, PluralOption... options);

    /**
     * Nesnenin tüm alanlarını doğrular.
     */
    ValidationErrors struct(String locale, Object value);

    /**
     * Belirtilen alanlar hariç nesneyi doğrular.
     */
    ValidationErrors structExcept(String locale, Object value, String... fields);

    /**
     * Yalnızca belirtilen alanları doğrular.
     */
    ValidationErrors structPartial(String locale, Object value, String... fields);

    /**
     * Tek bir değeri kural ifadesine göre doğrular.
     *
     * @param locale Mesaj dili
     * @param name   Hata kaydında ve mesajda kullanılacak alan adı
     * @param value  Doğrulanacak değer
     * @param rules  Virgülle ayrılmış kural ifadesi (örn: "required,min=3")
     */
    ValidationErrors var(String locale, String name, Object value, String rules);

    /**
     * Tek bir değeri başka bir değerle karşılaştırarak doğrular ({@code eqfield} gibi kurallar için).
     */
    ValidationErrors varWithValue(String locale, String name, Object value, Object other, String rules);
}
