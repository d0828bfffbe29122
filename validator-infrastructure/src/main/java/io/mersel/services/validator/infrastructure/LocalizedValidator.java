package io.mersel.services.validator.infrastructure;

import io.mersel.services.validator.application.enums.FormatRule;
import io.mersel.services.validator.application.interfaces.ILocalizedValidator;
import io.mersel.services.validator.application.interfaces.ITranslator;
import io.mersel.services.validator.application.interfaces.IValidationEngine;
import io.mersel.services.validator.application.interfaces.RulePredicate;
import io.mersel.services.validator.application.models.PluralOption;
import io.mersel.services.validator.application.models.ValidationErrors;
import io.mersel.services.validator.application.models.Violation;
import io.mersel.services.validator.infrastructure.diagnostics.ValidatorMetrics;
import io.mersel.services.validator.infrastructure.rules.FormatRules;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * {@link ILocalizedValidator} uygulaması.
 * <p>
 * Doğrulamayı {@link IValidationEngine}'e devreder, sonucu
 * {@link ErrorTranslationPipeline} ile yerelleştirir. Motor, çevirmen veya
 * {@code Translatable} kancalarından çıkan hatalar dışarı sızmaz; dönen
 * {@link ValidationErrors} içinde iç hata olarak taşınır.
 * <p>
 * Örnek:
 * <pre>{@code
 * var validator = LocalizedValidator.builder(engine)
 *         .translator(translator, "validation")
 *         .formatRule(FormatRule.IRANIAN_MOBILE)
 *         .rule("is_valid", ctx -> "valid".equals(ctx.value()), Map.of("en", "{field} is invalid"))
 *         .build();
 *
 * ValidationErrors errors = validator.var("fa", "mobile", "0912", "required,mobile");
 * }</pre>
 */
public class LocalizedValidator implements ILocalizedValidator {

    private static final Logger log = LoggerFactory.getLogger(LocalizedValidator.class);

    static final String ENTRY_STRUCT = "struct";
    static final String ENTRY_STRUCT_EXCEPT = "struct_except";
    static final String ENTRY_STRUCT_PARTIAL = "struct_partial";
    static final String ENTRY_VAR = "var";
    static final String ENTRY_VAR_WITH_VALUE = "var_with_value";

    private final IValidationEngine engine;
    private final TranslationResolver resolver;
    private final ErrorTranslationPipeline pipeline;
    private final ValidatorMetrics metrics;

    private LocalizedValidator(IValidationEngine engine, TranslationResolver resolver, ValidatorMetrics metrics) {
        this.engine = engine;
        this.resolver = resolver;
        this.pipeline = new ErrorTranslationPipeline(resolver);
        this.metrics = metrics;
    }

    public static Builder builder(IValidationEngine engine) {
        return new Builder(engine);
    }

    @Override
    public void addValidation(String rule, RulePredicate predicate) {
        if (rule == null || rule.isBlank() || predicate == null) {
            return;
        }
        engine.registerRule(rule.strip(), predicate);
    }

    @Override
    public void addTranslation(String locale, String rule, String template, PluralOption... options) {
        if (!resolver.hasTranslator() || rule == null || rule.isBlank()) {
            return;
        }
        resolver.getTranslator().addMessage(locale, resolver.applyPrefix(rule.strip()), template, options);
    }

    @Override
    public ValidationErrors struct(String locale, Object value) {
        return run(ENTRY_STRUCT, () -> engine.validateStruct(value),
                violations -> pipeline.translateStruct(locale, value, violations));
    }

    @Override
    public ValidationErrors structExcept(String locale, Object value, String... fields) {
        List<String> excluded = fields != null ? Arrays.asList(fields) : List.of();
        return run(ENTRY_STRUCT_EXCEPT, () -> engine.validateStructExcept(value, excluded),
                violations -> pipeline.translateStruct(locale, value, violations));
    }

    @Override
    public ValidationErrors structPartial(String locale, Object value, String... fields) {
        List<String> included = fields != null ? Arrays.asList(fields) : List.of();
        return run(ENTRY_STRUCT_PARTIAL, () -> engine.validateStructPartial(value, included),
                violations -> pipeline.translateStruct(locale, value, violations));
    }

    @Override
    public ValidationErrors var(String locale, String name, Object value, String rules) {
        return run(ENTRY_VAR, () -> engine.validateVar(value, rules),
                violations -> pipeline.translateVariable(locale, name, value, violations));
    }

    @Override
    public ValidationErrors varWithValue(String locale, String name, Object value, Object other, String rules) {
        return run(ENTRY_VAR_WITH_VALUE, () -> engine.validateVarWithValue(value, other, rules),
                violations -> pipeline.translateVariable(locale, name, value, violations));
    }

    public TranslationResolver getResolver() {
        return resolver;
    }

    private ValidationErrors run(String entry,
                                 Supplier<List<Violation>> validation,
                                 Function<List<Violation>, ValidationErrors> translation) {
        long start = System.nanoTime();

        List<Violation> violations;
        ValidationErrors result;
        try {
            violations = validation.get();
            result = translation.apply(violations);
        } catch (RuntimeException e) {
            log.warn("Doğrulama hatası ({}): {}", entry, e.getMessage());
            metrics.recordValidation(entry, ValidatorMetrics.RESULT_ERROR, Duration.ofNanos(System.nanoTime() - start));
            return ValidationErrors.ofInternalError(e);
        }

        if (violations != null && !violations.isEmpty()) {
            metrics.recordViolations(violations.stream().map(Violation::rule).toList());
        }
        metrics.recordValidation(entry,
                result.hasValidationErrors() ? ValidatorMetrics.RESULT_INVALID : ValidatorMetrics.RESULT_VALID,
                Duration.ofNanos(System.nanoTime() - start));
        return result;
    }

    /**
     * {@link LocalizedValidator} kurucusu.
     * <p>
     * Kurallar {@link #build()} anında motora, mesajlar çevirmene kaydedilir.
     * Çevirmen verilmemişse mesajlar yok sayılır ve motorun varsayılan mesajları kullanılır.
     */
    public static final class Builder {

        private final IValidationEngine engine;
        private ITranslator translator;
        private String prefix = "";
        private ValidatorMetrics metrics = ValidatorMetrics.noop();
        private final List<Registration> registrations = new ArrayList<>();

        private Builder(IValidationEngine engine) {
            this.engine = Objects.requireNonNull(engine, "engine");
        }

        public Builder translator(ITranslator translator, String prefix) {
            this.translator = translator;
            this.prefix = prefix;
            return this;
        }

        public Builder translator(ITranslator translator) {
            return translator(translator, "");
        }

        public Builder metrics(ValidatorMetrics metrics) {
            this.metrics = metrics != null ? metrics : ValidatorMetrics.noop();
            return this;
        }

        /**
         * Özel kural ve dil bazlı mesajlarını ekler.
         *
         * @param messages dil → şablon; {@code ""} kök kataloğa yazılır
         */
        public Builder rule(String name, RulePredicate predicate, Map<String, String> messages) {
            registrations.add(new Registration(name, predicate, orderedCopy(messages)));
            return this;
        }

        public Builder rule(String name, RulePredicate predicate) {
            return rule(name, predicate, Map.of());
        }

        /**
         * Hazır format kuralını varsayılan adı ve İngilizce kök mesajıyla ekler.
         */
        public Builder formatRule(FormatRule rule) {
            return formatRule(rule, rule.getDefaultRuleName(), Map.of());
        }

        public Builder formatRule(FormatRule rule, String ruleName) {
            return formatRule(rule, ruleName, Map.of());
        }

        /**
         * Hazır format kuralını özel ad ve dil bazlı mesajlarla ekler.
         * Kök katalogdaki varsayılan mesaj, verilen {@code ""} mesajıyla ezilebilir.
         */
        public Builder formatRule(FormatRule rule, String ruleName, Map<String, String> messages) {
            Objects.requireNonNull(rule, "rule");
            String name = ruleName == null || ruleName.isBlank() ? rule.getDefaultRuleName() : ruleName;

            var all = new LinkedHashMap<String, String>();
            all.put("", rule.getDefaultMessage());
            all.putAll(orderedCopy(messages));
            registrations.add(new Registration(name, FormatRules.predicateFor(rule), all));
            return this;
        }

        public LocalizedValidator build() {
            var validator = new LocalizedValidator(engine, new TranslationResolver(translator, prefix), metrics);

            for (Registration registration : registrations) {
                validator.addValidation(registration.name(), registration.predicate());
                if (translator == null) {
                    continue;
                }
                registration.messages().forEach((locale, template) ->
                        validator.addTranslation(locale, registration.name(), template));
            }

            log.debug("Yerelleştirilmiş doğrulayıcı oluşturuldu: {} ek kural, önek='{}'",
                    registrations.size(), validator.resolver.getPrefix());
            return validator;
        }

        private static Map<String, String> orderedCopy(Map<String, String> messages) {
            return messages != null ? new LinkedHashMap<>(messages) : Map.of();
        }

        private record Registration(String name, RulePredicate predicate, Map<String, String> messages) {
        }
    }
}
