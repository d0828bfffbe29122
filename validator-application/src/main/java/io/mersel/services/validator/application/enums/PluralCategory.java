package io.mersel.services.validator.application.enums;

import java.util.Locale;

/**
 * CLDR çoğul kategorileri.
 */
public enum PluralCategory {
    ZERO,
    ONE,
    TWO,
    FEW,
    MANY,
    OTHER;

    /**
     * YAML kataloglarında kullanılan küçük harfli anahtar ("one", "few" ...).
     */
    public String getKey() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Anahtardan kategori çözer; tanınmayan anahtar için {@code null} döner.
     */
    public static PluralCategory fromKey(String key) {
        if (key == null) {
            return null;
        }
        for (PluralCategory category : values()) {
            if (category.getKey().equalsIgnoreCase(key.strip())) {
                return category;
            }
        }
        return null;
    }
}
