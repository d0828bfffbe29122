package io.mersel.services.validator.infrastructure.config;

import io.mersel.services.validator.application.enums.FormatRule;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Yerelleştirilmiş doğrulayıcı yapılandırma özellikleri.
 * <p>
 * {@code i18n-validator} prefix'i altındaki değerleri okur.
 * <ul>
 *   <li>{@code translation-prefix}: Mesaj anahtarlarına eklenecek önek (boş = önek yok)</li>
 *   <li>{@code fallback-locale}: İstenen dilde mesaj yoksa denenecek dil</li>
 *   <li>{@code messages-location}: YAML mesaj kataloğu konumu ({@code classpath:} / {@code file:})</li>
 *   <li>{@code format-rules}: Etkinleştirilecek hazır format kuralları (varsayılan: hepsi)</li>
 *   <li>{@code field-name-cache-size}: Alan adı önbelleği boyutu (pozitif olmalı)</li>
 * </ul>
 */
@ConfigurationProperties(prefix = "i18n-validator")
public class ValidatorProperties {

    private static final Logger log = LoggerFactory.getLogger(ValidatorProperties.class);

    static final String DEFAULT_MESSAGES_LOCATION = "classpath:messages/validation-messages.yml";
    static final long DEFAULT_FIELD_NAME_CACHE_SIZE = 1_000;

    private String translationPrefix = "";
    private String fallbackLocale = "en";
    private String messagesLocation = DEFAULT_MESSAGES_LOCATION;
    private List<FormatRule> formatRules = new ArrayList<>(Arrays.asList(FormatRule.values()));
    private long fieldNameCacheSize = DEFAULT_FIELD_NAME_CACHE_SIZE;

    @PostConstruct
    void validate() {
        if (fieldNameCacheSize <= 0) {
            log.warn("field-name-cache-size değeri pozitif olmalı (verilen: {}), varsayılan {} kullanılıyor",
                    fieldNameCacheSize, DEFAULT_FIELD_NAME_CACHE_SIZE);
            fieldNameCacheSize = DEFAULT_FIELD_NAME_CACHE_SIZE;
        }
        if (messagesLocation == null || messagesLocation.isBlank()) {
            log.warn("messages-location boş, varsayılan katalog kullanılıyor: {}", DEFAULT_MESSAGES_LOCATION);
            messagesLocation = DEFAULT_MESSAGES_LOCATION;
        }
        if (translationPrefix == null) {
            translationPrefix = "";
        }
        if (fallbackLocale == null) {
            fallbackLocale = "";
        }
        if (formatRules == null) {
            formatRules = new ArrayList<>();
        }
    }

    public String getTranslationPrefix() {
        return translationPrefix;
    }

    public void setTranslationPrefix(String translationPrefix) {
        this.translationPrefix = translationPrefix;
    }

    public String getFallbackLocale() {
        return fallbackLocale;
    }

    public void setFallbackLocale(String fallbackLocale) {
        this.fallbackLocale = fallbackLocale;
    }

    public String getMessagesLocation() {
        return messagesLocation;
    }

    public void setMessagesLocation(String messagesLocation) {
        this.messagesLocation = messagesLocation;
    }

    public List<FormatRule> getFormatRules() {
        return formatRules;
    }

    public void setFormatRules(List<FormatRule> formatRules) {
        this.formatRules = formatRules;
    }

    public long getFieldNameCacheSize() {
        return fieldNameCacheSize;
    }

    public void setFieldNameCacheSize(long fieldNameCacheSize) {
        this.fieldNameCacheSize = fieldNameCacheSize;
    }
}
