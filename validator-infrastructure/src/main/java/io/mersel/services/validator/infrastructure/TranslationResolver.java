package io.mersel.services.validator.infrastructure;

import io.mersel.services.validator.application.interfaces.ITranslator;
import io.mersel.services.validator.application.interfaces.Translatable;
import io.mersel.services.validator.application.interfaces.TranslatableField;
import io.mersel.services.validator.application.models.TranslationContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;

/**
 * Tek bir ihlal kaydı için yerelleştirilmiş mesajı üretir.
 * <p>
 * Çözümleme sırası:
 * <ol>
 *   <li>Çevirmen yoksa boş string (hat motorun varsayılan mesajına düşer)</li>
 *   <li>Doğrulanan değer {@link Translatable} ise ve boş olmayan sonuç dönerse o kullanılır</li>
 *   <li>Kural adına önek uygulanır ({@code önek.kural})</li>
 *   <li>Değer {@link TranslatableField} ise ve boş olmayan başlık dönerse alan adı ezilir</li>
 *   <li>Genel çevirmen {@code {field}} ve {@code {param}} ile çağrılır</li>
 * </ol>
 */
public final class TranslationResolver {

    private static final Logger log = LoggerFactory.getLogger(TranslationResolver.class);

    static final String SEPARATOR = ".";

    private final ITranslator translator;
    private final String prefix;

    public TranslationResolver(ITranslator translator, String prefix) {
        this.translator = translator;
        this.prefix = prefix != null ? prefix.strip() : "";
    }

    public boolean hasTranslator() {
        return translator != null;
    }

    public ITranslator getTranslator() {
        return translator;
    }

    public String getPrefix() {
        return prefix;
    }

    /**
     * Kural adına yapılandırılmış öneki uygular. Önek boşsa kural aynen döner.
     */
    public String applyPrefix(String rule) {
        return prefix.isEmpty() ? rule : prefix + SEPARATOR + rule;
    }

    public String translate(TranslationContext ctx) {
        if (translator == null) {
            return "";
        }

        Object value = ctx.sourceValue();
        if (value instanceof Translatable translatable) {
            String custom = translatable.translateError(ctx.locale(), ctx.ruleKey(), ctx.structFieldName());
            if (custom != null && !custom.isEmpty()) {
                log.debug("Değer kendi hata mesajını üretti: {} / {}", ctx.structFieldName(), ctx.ruleKey());
                return custom;
            }
        }

        String key = applyPrefix(ctx.ruleKey());

        String name = ctx.displayName();
        if (value instanceof TranslatableField translatableField) {
            String title = translatableField.translateTitle(ctx.locale(), ctx.structFieldName());
            if (title != null && !title.isEmpty()) {
                name = title;
            }
        }

        // Map.of null değer kabul etmez
        Map<String, Object> params = new HashMap<>();
        params.put("field", name);
        params.put("param", ctx.param());

        return translator.plural(ctx.locale(), key, ctx.count(), params);
    }
}
