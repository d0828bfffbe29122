package io.mersel.services.validator.infrastructure.engine;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.mersel.services.validator.application.constraints.Rule;
import io.mersel.services.validator.application.interfaces.IFieldNameResolver;
import io.mersel.services.validator.application.interfaces.IValidationEngine;
import io.mersel.services.validator.application.interfaces.RulePredicate;
import io.mersel.services.validator.application.interfaces.ValidationEngineException;
import io.mersel.services.validator.application.models.RuleContext;
import io.mersel.services.validator.application.models.Violation;
import io.mersel.services.validator.infrastructure.rules.BuiltinRules;
import io.mersel.services.validator.infrastructure.rules.RuleRegistry;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Path;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.hibernate.validator.HibernateValidator;
import org.hibernate.validator.HibernateValidatorConfiguration;
import org.hibernate.validator.cfg.ConstraintMapping;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Field;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Hibernate Validator tabanlı doğrulama motoru.
 * <p>
 * Bean doğrulamada standart Jakarta kısıtları ve {@link Rule} kısıtı birlikte
 * değerlendirilir; {@link Rule} kısıtları {@link RuleRegistry} üzerinden çözülür.
 * Alan karşılaştırma kuralları ({@code eqfield}, {@code nefield}) kardeş alanın
 * değeriyle {@link FieldComparisons} üzerinden değerlendirilir.
 * Değişken doğrulamada kural ifadesi doğrudan kayıt defteri ile değerlendirilir
 * ve ilk başarısız kuralda durulur.
 * <p>
 * Alan adı çözümlemesi {@link IFieldNameResolver} ile yapılır, sonuçlar
 * (sınıf, özellik) anahtarıyla Caffeine önbelleğinde tutulur.
 */
public class HibernateValidationEngine implements IValidationEngine {

    private static final Logger log = LoggerFactory.getLogger(HibernateValidationEngine.class);

    static final String OMIT_EMPTY = "omitempty";
    private static final String RULE_MESSAGE_FORMAT = "failed on the '%s' rule";

    private final RuleRegistry registry;
    private final IFieldNameResolver fieldNameResolver;
    private final ValidatorFactory validatorFactory;
    private final Validator validator;
    private final Cache<FieldKey, String> fieldNames;
    private final FieldComparisons fieldComparisons;

    public HibernateValidationEngine(RuleRegistry registry, IFieldNameResolver fieldNameResolver, long fieldNameCacheSize) {
        this.registry = registry;
        this.fieldNameResolver = fieldNameResolver != null ? fieldNameResolver : field -> null;
        this.fieldComparisons = new FieldComparisons(registry);
        this.fieldNames = Caffeine.newBuilder()
                .maximumSize(fieldNameCacheSize > 0 ? fieldNameCacheSize : 1_000)
                .build();

        HibernateValidatorConfiguration configuration = Validation.byProvider(HibernateValidator.class).configure();
        ConstraintMapping mapping = configuration.createConstraintMapping();
        mapping.constraintDefinition(Rule.class)
                .includeExistingValidators(false)
                .validatedBy(RuleConstraintValidator.class);

        this.validatorFactory = configuration
                .addMapping(mapping)
                .constraintValidatorFactory(new RuleAwareConstraintValidatorFactory(
                        configuration.getDefaultConstraintValidatorFactory(), registry))
                .defaultLocale(Locale.ENGLISH)
                .buildValidatorFactory();
        this.validator = validatorFactory.getValidator();

        log.info("Doğrulama motoru hazır: {} kural kayıtlı", registry.names().size());
    }

    public HibernateValidationEngine(RuleRegistry registry) {
        this(registry, new AnnotationFieldNameResolver(), 1_000);
    }

    @Override
    public List<Violation> validateStruct(Object value) {
        return collect(value, path -> true);
    }

    @Override
    public List<Violation> validateStructExcept(Object value, Collection<String> excludedFields) {
        List<String> excluded = normalize(value, excludedFields);
        return collect(value, path -> excluded.stream().noneMatch(field -> matches(path, field)));
    }

    @Override
    public List<Violation> validateStructPartial(Object value, Collection<String> includedFields) {
        List<String> included = normalize(value, includedFields);
        return collect(value, path -> included.stream().anyMatch(field -> matches(path, field)));
    }

    @Override
    public List<Violation> validateVar(Object value, String ruleExpression) {
        return validateVarWithValue(value, null, ruleExpression);
    }

    @Override
    public List<Violation> validateVarWithValue(Object value, Object other, String ruleExpression) {
        for (RuleCall call : RuleExpressionParser.parse(ruleExpression)) {
            if (OMIT_EMPTY.equals(call.name())) {
                if (!BuiltinRules.isPresent(value)) {
                    return List.of();
                }
                continue;
            }

            RulePredicate predicate = registry.get(call.name());
            if (!predicate.test(new RuleContext(value, call.param(), other))) {
                return List.of(new Violation("", "", call.name(), call.param(), defaultMessage(call.name())));
            }
        }
        return List.of();
    }

    @Override
    public void registerRule(String rule, RulePredicate predicate) {
        registry.register(rule, predicate);
        log.debug("Özel kural kaydedildi: {}", rule);
    }

    @Override
    public Set<String> getRuleNames() {
        return registry.names();
    }

    /**
     * Motorun kapanışında Hibernate fabrikasını serbest bırakır.
     */
    public void close() {
        validatorFactory.close();
    }

    private List<Violation> collect(Object value, Predicate<String> pathFilter) {
        requireBean(value);

        List<String> declared = declaredFieldNames(value.getClass());
        var found = new ArrayList<Located>();
        for (ConstraintViolation<Object> violation : validator.validate(value)) {
            found.add(new Located(violation.getPropertyPath().toString(), toViolation(violation)));
        }
        for (FieldComparisons.Failure failure : fieldComparisons.evaluate(value)) {
            found.add(new Located(failure.path(), toViolation(failure)));
        }

        return found.stream()
                .filter(located -> pathFilter.test(located.path()))
                .sorted(Comparator
                        .comparingInt((Located located) -> declarationIndex(declared, located.path()))
                        .thenComparing(Located::path)
                        .thenComparing(located -> located.violation().rule()))
                .map(Located::violation)
                .toList();
    }

    private Violation toViolation(ConstraintViolation<Object> violation) {
        String property = leafName(violation.getPropertyPath());
        Object leafBean = violation.getLeafBean();
        String field = leafBean != null ? displayName(leafBean.getClass(), property) : property;

        return new Violation(
                field,
                property,
                ConstraintNames.ruleName(violation.getConstraintDescriptor()),
                ConstraintNames.param(violation.getConstraintDescriptor()),
                violation.getMessage());
    }

    private Violation toViolation(FieldComparisons.Failure failure) {
        String rule = failure.rule().value();
        return new Violation(
                displayName(failure.leafBean().getClass(), failure.property()),
                failure.property(),
                rule,
                failure.rule().param(),
                defaultMessage(rule));
    }

    private String displayName(Class<?> type, String property) {
        return fieldNames.get(new FieldKey(type, property), key -> {
            String resolved = findField(key.type(), key.property())
                    .map(fieldNameResolver::resolve)
                    .orElse(null);
            return resolved != null ? resolved : key.property();
        });
    }

    private static String defaultMessage(String rule) {
        return String.format(RULE_MESSAGE_FORMAT, rule);
    }

    private static void requireBean(Object value) {
        if (value == null) {
            throw new ValidationEngineException("Doğrulanacak nesne null olamaz");
        }
        if (!FieldComparisons.isBean(value)) {
            throw new ValidationEngineException(
                    "Bean doğrulama yalnızca nesneler için yapılabilir, verilen tip: " + value.getClass().getName());
        }
    }

    /**
     * Alan adlarındaki {@code SinifAdi.} önekini atar ve boş girdileri eler.
     */
    private static List<String> normalize(Object value, Collection<String> fields) {
        if (fields == null) {
            return List.of();
        }
        String typePrefix = value != null ? value.getClass().getSimpleName() + "." : "";
        var result = new ArrayList<String>();
        for (String field : fields) {
            if (field == null || field.isBlank()) {
                continue;
            }
            String name = field.strip();
            if (!typePrefix.equals(".") && name.startsWith(typePrefix)) {
                name = name.substring(typePrefix.length());
            }
            result.add(name);
        }
        return result;
    }

    static boolean matches(String path, String field) {
        return path.equals(field) || path.startsWith(field + ".") || path.startsWith(field + "[");
    }

    private static String leafName(Path path) {
        String name = "";
        for (Path.Node node : path) {
            if (node.getName() != null) {
                name = node.getName();
            }
        }
        return name;
    }

    private static int declarationIndex(List<String> declared, String path) {
        int end = path.length();
        for (int i = 0; i < path.length(); i++) {
            char c = path.charAt(i);
            if (c == '.' || c == '[') {
                end = i;
                break;
            }
        }
        if (end == 0) {
            return -1;
        }
        int index = declared.indexOf(path.substring(0, end));
        return index >= 0 ? index : declared.size();
    }

    private static List<String> declaredFieldNames(Class<?> type) {
        var names = new ArrayList<String>();
        for (Class<?> current = type; current != null && current != Object.class; current = current.getSuperclass()) {
            for (Field field : current.getDeclaredFields()) {
                names.add(field.getName());
            }
        }
        return names;
    }

    private static Optional<Field> findField(Class<?> type, String name) {
        for (Class<?> current = type; current != null && current != Object.class; current = current.getSuperclass()) {
            try {
                return Optional.of(current.getDeclaredField(name));
            } catch (NoSuchFieldException e) {
                log.trace("{} sınıfında {} alanı yok, üst sınıfa bakılıyor", current.getName(), name);
            }
        }
        return Optional.empty();
    }

    private record FieldKey(Class<?> type, String property) {
    }

    private record Located(String path, Violation violation) {
    }
}
