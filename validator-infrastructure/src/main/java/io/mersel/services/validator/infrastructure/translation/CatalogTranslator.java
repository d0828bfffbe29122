package io.mersel.services.validator.infrastructure.translation;

import io.mersel.services.validator.application.enums.PluralCategory;
import io.mersel.services.validator.application.interfaces.ITranslator;
import io.mersel.services.validator.application.models.PluralOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Bellek içi, dil bazlı mesaj kataloğu.
 * <p>
 * Dil çözümleme sırası: tam etiket ({@code fa-IR}), dil alt etiketi ({@code fa}),
 * yapılandırılmış yedek dil, kök katalog ({@code ""}). Hiçbirinde anahtar
 * yoksa boş string döner.
 * <p>
 * Çoğul biçim, istenen dilin {@link PluralRules} kurallarıyla seçilir; seçilen
 * kategori için şablon yoksa varsayılan şablon kullanılır.
 */
public class CatalogTranslator implements ITranslator {

    private static final Logger log = LoggerFactory.getLogger(CatalogTranslator.class);

    public static final String ROOT_LOCALE = "";

    private final Map<String, Map<String, Message>> catalogs = new ConcurrentHashMap<>();
    private final String fallbackLocale;

    public CatalogTranslator(String fallbackLocale) {
        this.fallbackLocale = normalize(fallbackLocale);
    }

    public CatalogTranslator() {
        this(ROOT_LOCALE);
    }

    @Override
    public String plural(String locale, String key, int count, Map<String, Object> params) {
        if (key == null) {
            return "";
        }

        String requested = normalize(locale);
        for (String candidate : lookupChain(requested)) {
            Map<String, Message> catalog = catalogs.get(candidate);
            Message message = catalog != null ? catalog.get(key) : null;
            if (message != null) {
                String pluralLocale = requested.isEmpty() ? candidate : requested;
                PluralCategory category = PluralRules.forLocale(pluralLocale).select(count);
                return MessageTemplate.format(message.templateFor(category), params);
            }
        }

        log.debug("Çeviri bulunamadı: dil='{}', anahtar='{}'", requested, key);
        return "";
    }

    @Override
    public void addMessage(String locale, String key, String template, PluralOption... options) {
        if (key == null || key.isBlank() || template == null) {
            return;
        }

        var forms = new EnumMap<PluralCategory, String>(PluralCategory.class);
        if (options != null) {
            for (PluralOption option : options) {
                if (option != null) {
                    forms.put(option.category(), option.template());
                }
            }
        }

        catalogs.computeIfAbsent(normalize(locale), l -> new ConcurrentHashMap<>())
                .put(key, new Message(template, Map.copyOf(forms)));
    }

    @Override
    public boolean hasMessage(String locale, String key) {
        Map<String, Message> catalog = catalogs.get(normalize(locale));
        return catalog != null && key != null && catalog.containsKey(key);
    }

    /**
     * Kayıtlı dil etiketleri (kök katalog dahil).
     */
    public Set<String> getLocales() {
        return Set.copyOf(catalogs.keySet());
    }

    public String getFallbackLocale() {
        return fallbackLocale;
    }

    private List<String> lookupChain(String locale) {
        var chain = new LinkedHashSet<String>();
        chain.add(locale);
        int dash = locale.indexOf('-');
        if (dash > 0) {
            chain.add(locale.substring(0, dash));
        }
        chain.add(fallbackLocale);
        chain.add(ROOT_LOCALE);
        return List.copyOf(chain);
    }

    /**
     * {@code fa_IR} ve {@code FA-ir} gibi girdileri {@code fa-IR} biçimine getirir.
     */
    static String normalize(String locale) {
        if (locale == null || locale.isBlank()) {
            return ROOT_LOCALE;
        }
        String tag = Locale.forLanguageTag(locale.strip().replace('_', '-')).toLanguageTag();
        return "und".equals(tag) ? ROOT_LOCALE : tag;
    }

    private record Message(String template, Map<PluralCategory, String> forms) {

        String templateFor(PluralCategory category) {
            return forms.getOrDefault(category, template);
        }
    }
}
