package io.mersel.services.validator.application.models;

/**
 * Tek bir ihlal kaydının çevirisi için gereken bilgiler.
 *
 * @param locale          Dil etiketi
 * @param displayName     Mesajda {@code {field}} yerine geçecek ad
 * @param ruleKey         Önek uygulanmamış kural adı
 * @param structFieldName Java alan adı (değişken doğrulamada çağıranın verdiği ad)
 * @param param           Sayısal dönüşümden geçmiş parametre
 * @param sourceValue     Doğrulanan değer (çeviri yetenekleri bu nesne üzerinden aranır)
 * @param count           Çoğul biçim sayısı
 */
public record TranslationContext(
        String locale,
        String displayName,
        String ruleKey,
        String structFieldName,
        Object param,
        Object sourceValue,
        int count
) {
}
