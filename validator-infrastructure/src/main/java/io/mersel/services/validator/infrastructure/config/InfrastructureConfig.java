package io.mersel.services.validator.infrastructure.config;

import io.mersel.services.validator.application.enums.FormatRule;
import io.mersel.services.validator.application.interfaces.IFieldNameResolver;
import io.mersel.services.validator.application.interfaces.ILocalizedValidator;
import io.mersel.services.validator.application.interfaces.IValidationEngine;
import io.mersel.services.validator.infrastructure.LocalizedValidator;
import io.mersel.services.validator.infrastructure.TranslationResolver;
import io.mersel.services.validator.infrastructure.diagnostics.ValidatorHealthCheck;
import io.mersel.services.validator.infrastructure.diagnostics.ValidatorMetrics;
import io.mersel.services.validator.infrastructure.engine.AnnotationFieldNameResolver;
import io.mersel.services.validator.infrastructure.engine.HibernateValidationEngine;
import io.mersel.services.validator.infrastructure.rules.RuleRegistry;
import io.mersel.services.validator.infrastructure.translation.CatalogTranslator;
import io.mersel.services.validator.infrastructure.translation.MessageCatalogLoader;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Altyapı katmanı Spring yapılandırması.
 * <p>
 * Kural kayıt defteri, Hibernate doğrulama motoru, YAML kataloglu çevirmen,
 * sağlık kontrolü, metrikler ve {@link ILocalizedValidator} bean'lerini oluşturur.
 */
@Configuration
@EnableConfigurationProperties(ValidatorProperties.class)
public class InfrastructureConfig {

    private static final Logger log = LoggerFactory.getLogger(InfrastructureConfig.class);

    @Bean
    public RuleRegistry ruleRegistry() {
        return RuleRegistry.withBuiltins();
    }

    @Bean
    public IFieldNameResolver fieldNameResolver() {
        return new AnnotationFieldNameResolver();
    }

    @Bean(destroyMethod = "close")
    public HibernateValidationEngine validationEngine(RuleRegistry ruleRegistry,
                                                     IFieldNameResolver fieldNameResolver,
                                                     ValidatorProperties properties) {
        return new HibernateValidationEngine(ruleRegistry, fieldNameResolver, properties.getFieldNameCacheSize());
    }

    @Bean
    public CatalogTranslator catalogTranslator(ValidatorProperties properties, ResourceLoader resourceLoader) {
        var translator = new CatalogTranslator(properties.getFallbackLocale());
        var resolver = new TranslationResolver(translator, properties.getTranslationPrefix());
        try {
            new MessageCatalogLoader(resourceLoader)
                    .load(properties.getMessagesLocation(), translator, resolver::applyPrefix);
        } catch (IOException e) {
            throw new UncheckedIOException("Mesaj kataloğu okunamadı: " + properties.getMessagesLocation(), e);
        }
        return translator;
    }

    @Bean
    public ValidatorHealthCheck validatorHealthCheck(IValidationEngine validationEngine,
                                                     CatalogTranslator catalogTranslator) {
        return new ValidatorHealthCheck(validationEngine, catalogTranslator);
    }

    @Bean
    public ValidatorMetrics validatorMetrics(ObjectProvider<MeterRegistry> meterRegistry) {
        return new ValidatorMetrics(meterRegistry.getIfAvailable());
    }

    @Bean
    public ILocalizedValidator localizedValidator(IValidationEngine validationEngine,
                                                  CatalogTranslator catalogTranslator,
                                                  ValidatorMetrics validatorMetrics,
                                                  ValidatorProperties properties) {
        var builder = LocalizedValidator.builder(validationEngine)
                .translator(catalogTranslator, properties.getTranslationPrefix())
                .metrics(validatorMetrics);
        for (FormatRule rule : properties.getFormatRules()) {
            builder.formatRule(rule);
        }

        log.info("Yerelleştirilmiş doğrulayıcı hazır: {} format kuralı, yedek dil='{}', önek='{}'",
                properties.getFormatRules().size(), properties.getFallbackLocale(), properties.getTranslationPrefix());
        return builder.build();
    }
}
