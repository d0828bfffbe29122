package io.mersel.services.validator.infrastructure.engine;

import io.mersel.services.validator.application.constraints.Rule;
import io.mersel.services.validator.application.interfaces.ValidationEngineException;
import io.mersel.services.validator.application.models.RuleContext;
import io.mersel.services.validator.infrastructure.rules.BuiltinRules;
import io.mersel.services.validator.infrastructure.rules.RuleRegistry;
import jakarta.validation.Valid;

import java.lang.reflect.Field;
import java.lang.reflect.InaccessibleObjectException;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Bean içindeki alan karşılaştırma kurallarını ({@code eqfield}, {@code nefield}) değerlendirir.
 * <p>
 * {@link Rule#param()} aynı nesnedeki kardeş alanın Java adıdır. {@link Valid} ile
 * işaretli iç içe nesneler, liste ve map elemanları da dolaşılır. Üretilen yollar
 * Hibernate Validator'ın özellik yolu biçimindedir ({@code items[0].confirm}).
 */
final class FieldComparisons {

    private final RuleRegistry registry;

    FieldComparisons(RuleRegistry registry) {
        this.registry = registry;
    }

    /**
     * Başarısız karşılaştırma.
     *
     * @param path     Kökten itibaren özellik yolu
     * @param leafBean Alanı taşıyan nesne
     * @param property Alanın Java adı
     * @param rule     Başarısız kural
     */
    record Failure(String path, Object leafBean, String property, Rule rule) {
    }

    List<Failure> evaluate(Object root) {
        var failures = new ArrayList<Failure>();
        walk(root, "", failures, Collections.newSetFromMap(new IdentityHashMap<>()));
        return failures;
    }

    static boolean isBean(Object value) {
        return value != null
                && !(value instanceof CharSequence || value instanceof Number || value instanceof Boolean
                || value instanceof Character || value instanceof Enum<?> || value instanceof Collection<?>
                || value instanceof Map<?, ?> || value instanceof Optional<?> || value.getClass().isArray());
    }

    private void walk(Object bean, String prefix, List<Failure> failures, Set<Object> visited) {
        if (!visited.add(bean)) {
            return;
        }

        for (Field field : instanceFields(bean.getClass())) {
            Rule[] rules = field.getAnnotationsByType(Rule.class);
            boolean cascade = field.isAnnotationPresent(Valid.class);
            if (!cascade && !hasComparison(rules)) {
                continue;
            }

            Object value = read(field, bean);
            String path = prefix + field.getName();
            for (Rule rule : rules) {
                if (!BuiltinRules.FIELD_COMPARISON_RULES.contains(rule.value())) {
                    continue;
                }
                Object other = read(sibling(bean.getClass(), rule.param()), bean);
                if (!registry.get(rule.value()).test(new RuleContext(value, rule.param(), other))) {
                    failures.add(new Failure(path, bean, field.getName(), rule));
                }
            }

            if (cascade && value != null) {
                cascade(value, path, failures, visited);
            }
        }
    }

    private void cascade(Object value, String path, List<Failure> failures, Set<Object> visited) {
        if (value instanceof List<?> items) {
            for (int i = 0; i < items.size(); i++) {
                descend(items.get(i), path + "[" + i + "].", failures, visited);
            }
        } else if (value instanceof Iterable<?> items) {
            for (Object item : items) {
                descend(item, path + "[].", failures, visited);
            }
        } else if (value instanceof Map<?, ?> map) {
            map.forEach((key, item) -> descend(item, path + "[" + key + "].", failures, visited));
        } else if (value instanceof Optional<?> optional) {
            optional.ifPresent(item -> descend(item, path + ".", failures, visited));
        } else {
            descend(value, path + ".", failures, visited);
        }
    }

    private void descend(Object item, String prefix, List<Failure> failures, Set<Object> visited) {
        // JDK tipleri (LocalDate vb.) dolaşılmaz
        if (isBean(item) && !item.getClass().getName().startsWith("java.")) {
            walk(item, prefix, failures, visited);
        }
    }

    private static boolean hasComparison(Rule[] rules) {
        for (Rule rule : rules) {
            if (BuiltinRules.FIELD_COMPARISON_RULES.contains(rule.value())) {
                return true;
            }
        }
        return false;
    }

    private static Field sibling(Class<?> type, String name) {
        String property = name != null ? name.strip() : "";
        for (Class<?> current = type; current != null && current != Object.class; current = current.getSuperclass()) {
            for (Field field : current.getDeclaredFields()) {
                if (field.getName().equals(property) && !Modifier.isStatic(field.getModifiers())) {
                    return field;
                }
            }
        }
        throw new ValidationEngineException(
                "Karşılaştırma alanı bulunamadı: " + type.getSimpleName() + "." + property);
    }

    private static Object read(Field field, Object bean) {
        try {
            field.setAccessible(true);
            return field.get(bean);
        } catch (IllegalAccessException | InaccessibleObjectException e) {
            throw new ValidationEngineException("Alan okunamadı: " + field.getName(), e);
        }
    }

    private static List<Field> instanceFields(Class<?> type) {
        var fields = new ArrayList<Field>();
        for (Class<?> current = type; current != null && current != Object.class; current = current.getSuperclass()) {
            for (Field field : current.getDeclaredFields()) {
                if (!Modifier.isStatic(field.getModifiers())) {
                    fields.add(field);
                }
            }
        }
        return fields;
    }
}
