package io.mersel.services.validator.web.infrastructure;

import java.util.List;
import java.util.Locale;

/**
 * İstek dilini çözer: önce {@code locale} parametresi, sonra {@code Accept-Language}
 * başlığındaki en yüksek öncelikli dil. İkisi de yoksa boş string (kök katalog).
 */
public final class RequestLocales {

    private RequestLocales() {}

    public static String resolve(String localeParam, String acceptLanguage) {
        if (localeParam != null && !localeParam.isBlank()) {
            return localeParam.strip();
        }
        if (acceptLanguage == null || acceptLanguage.isBlank()) {
            return "";
        }

        List<Locale.LanguageRange> ranges;
        try {
            ranges = Locale.LanguageRange.parse(acceptLanguage);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Geçersiz Accept-Language başlığı: " + acceptLanguage, e);
        }

        return ranges.stream()
                .map(Locale.LanguageRange::getRange)
                .filter(range -> !"*".equals(range))
                .findFirst()
                .orElse("");
    }
}
