package io.mersel.services.validator.infrastructure.translation;

import io.mersel.services.validator.application.enums.PluralCategory;
import io.mersel.services.validator.application.interfaces.ITranslator;
import io.mersel.services.validator.application.models.PluralOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * YAML mesaj kataloglarını {@link ITranslator}'a yükler.
 * <p>
 * Beklenen yapı:
 * <pre>
 * root:                      # kök katalog ("")
 *   required: "{field} is a required field"
 * en:
 *   min:
 *     one: "{field} must be at least {param} character in length"
 *     other: "{field} must be at least {param} characters in length"
 * </pre>
 * Mesaj değeri düz string ya da çoğul kategori anahtarlı bir map olabilir.
 * Map biçiminde {@code other} varsayılan şablondur.
 */
public class MessageCatalogLoader {

    private static final Logger log = LoggerFactory.getLogger(MessageCatalogLoader.class);

    static final String ROOT_KEY = "root";

    private final ResourceLoader resourceLoader;

    public MessageCatalogLoader(ResourceLoader resourceLoader) {
        this.resourceLoader = resourceLoader != null ? resourceLoader : new DefaultResourceLoader();
    }

    public MessageCatalogLoader() {
        this(new DefaultResourceLoader());
    }

    /**
     * Verilen konumdaki kataloğu yükler ({@code classpath:} veya {@code file:} önekli).
     *
     * @param keyMapper Mesaj anahtarına uygulanacak dönüşüm (örn: önek ekleme)
     * @return yüklenen mesaj sayısı; dosya yoksa 0
     * @throws IOException dosya okunamazsa
     */
    public int load(String location, ITranslator translator, UnaryOperator<String> keyMapper) throws IOException {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            log.warn("Mesaj kataloğu bulunamadı: {}", location);
            return 0;
        }

        try (InputStream is = resource.getInputStream()) {
            int count = load(is, translator, keyMapper);
            log.info("Mesaj kataloğu yüklendi: {} ({} mesaj)", location, count);
            return count;
        }
    }

    @SuppressWarnings("unchecked")
    public int load(InputStream is, ITranslator translator, UnaryOperator<String> keyMapper) {
        Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
        Object root = yaml.load(is);
        if (!(root instanceof Map<?, ?> locales)) {
            return 0;
        }

        UnaryOperator<String> mapper = keyMapper != null ? keyMapper : UnaryOperator.identity();
        int count = 0;
        for (var localeEntry : locales.entrySet()) {
            String locale = String.valueOf(localeEntry.getKey());
            if (ROOT_KEY.equals(locale)) {
                locale = CatalogTranslator.ROOT_LOCALE;
            }
            if (!(localeEntry.getValue() instanceof Map<?, ?> messages)) {
                log.warn("  Geçersiz katalog bölümü atlandı: {}", localeEntry.getKey());
                continue;
            }

            for (var messageEntry : ((Map<Object, Object>) messages).entrySet()) {
                String key = mapper.apply(String.valueOf(messageEntry.getKey()));
                Object value = messageEntry.getValue();
                if (value instanceof Map<?, ?> forms) {
                    count += addPluralMessage(translator, locale, key, forms) ? 1 : 0;
                } else if (value != null) {
                    translator.addMessage(locale, key, String.valueOf(value));
                    count++;
                }
            }
        }
        return count;
    }

    private static boolean addPluralMessage(ITranslator translator, String locale, String key, Map<?, ?> forms) {
        var options = new ArrayList<PluralOption>();
        String defaultTemplate = null;

        for (var form : forms.entrySet()) {
            PluralCategory category = PluralCategory.fromKey(String.valueOf(form.getKey()));
            if (category == null || form.getValue() == null) {
                log.warn("  Tanınmayan çoğul kategori atlandı: {}.{} -> {}", locale, key, form.getKey());
                continue;
            }
            String template = String.valueOf(form.getValue());
            options.add(new PluralOption(category, template));
            if (category == PluralCategory.OTHER) {
                defaultTemplate = template;
            }
        }

        if (defaultTemplate == null && !options.isEmpty()) {
            defaultTemplate = options.get(options.size() - 1).template();
        }
        if (defaultTemplate == null) {
            return false;
        }
        translator.addMessage(locale, key, defaultTemplate, options.toArray(PluralOption[]::new));
        return true;
    }
}
