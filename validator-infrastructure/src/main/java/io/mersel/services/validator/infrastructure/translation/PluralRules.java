package io.mersel.services.validator.infrastructure.translation;

import io.mersel.services.validator.application.enums.PluralCategory;

import java.util.Locale;
import java.util.Map;

/**
 * Dile özgü çoğul kategori seçimi (CLDR kardinal kuralları, tamsayı sayılar için).
 * <pre>
 * en: 1 → ONE, diğer → OTHER
 * fa: 0, 1 → ONE, diğer → OTHER
 * ru: 1, 21 → ONE, 2-4 → FEW, 5-20 → MANY
 * </pre>
 */
@FunctionalInterface
public interface PluralRules {

    PluralCategory select(int count);

    PluralRules ONE_OTHER = count -> count == 1 ? PluralCategory.ONE : PluralCategory.OTHER;

    PluralRules ZERO_ONE_OTHER = count -> count == 0 || count == 1 ? PluralCategory.ONE : PluralCategory.OTHER;

    PluralRules OTHER_ONLY = count -> PluralCategory.OTHER;

    PluralRules ARABIC = count -> {
        int mod100 = Math.abs(count) % 100;
        if (count == 0) return PluralCategory.ZERO;
        if (count == 1) return PluralCategory.ONE;
        if (count == 2) return PluralCategory.TWO;
        if (mod100 >= 3 && mod100 <= 10) return PluralCategory.FEW;
        if (mod100 >= 11) return PluralCategory.MANY;
        return PluralCategory.OTHER;
    };

    PluralRules EAST_SLAVIC = count -> {
        int n = Math.abs(count);
        int mod10 = n % 10;
        int mod100 = n % 100;
        if (mod10 == 1 && mod100 != 11) return PluralCategory.ONE;
        if (mod10 >= 2 && mod10 <= 4 && (mod100 < 12 || mod100 > 14)) return PluralCategory.FEW;
        return PluralCategory.MANY;
    };

    Map<String, PluralRules> BY_LANGUAGE = Map.ofEntries(
            Map.entry("en", ONE_OTHER),
            Map.entry("de", ONE_OTHER),
            Map.entry("tr", ONE_OTHER),
            Map.entry("es", ONE_OTHER),
            Map.entry("it", ONE_OTHER),
            Map.entry("fa", ZERO_ONE_OTHER),
            Map.entry("fr", ZERO_ONE_OTHER),
            Map.entry("ar", ARABIC),
            Map.entry("ru", EAST_SLAVIC),
            Map.entry("uk", EAST_SLAVIC),
            Map.entry("ja", OTHER_ONLY),
            Map.entry("zh", OTHER_ONLY)
    );

    /**
     * Dil etiketine ("fa-IR", "en_US", "tr") göre kuralları döner.
     * Tanınmayan veya boş etiketlerde {@link #ONE_OTHER} kullanılır.
     */
    static PluralRules forLocale(String locale) {
        if (locale == null || locale.isBlank()) {
            return ONE_OTHER;
        }
        String language = Locale.forLanguageTag(locale.strip().replace('_', '-')).getLanguage();
        return BY_LANGUAGE.getOrDefault(language, ONE_OTHER);
    }
}
