package io.mersel.services.validator.infrastructure.engine;

import io.mersel.services.validator.application.constraints.Rule;
import jakarta.validation.metadata.ConstraintDescriptor;

import java.lang.annotation.Annotation;
import java.util.List;
import java.util.Map;

/**
 * Bean Validation kısıtlarından kural adı ve parametre çıkarır.
 * <p>
 * {@link Rule} için adı ve parametreyi doğrudan annotation'dan alır. Diğer kısıtlarda
 * kural adı annotation adının snake_case hali ({@code NotBlank} → {@code not_blank}),
 * parametre ise {@code value, max, min, regexp, integer} özniteliklerinden
 * varsayılan olmayan ilkidir.
 */
final class ConstraintNames {

    private static final List<String> PARAM_ATTRIBUTES = List.of("value", "max", "min", "regexp", "integer");

    private ConstraintNames() {}

    static String ruleName(ConstraintDescriptor<?> descriptor) {
        Annotation annotation = descriptor.getAnnotation();
        if (annotation instanceof Rule rule) {
            return rule.value();
        }
        return toSnakeCase(annotation.annotationType().getSimpleName());
    }

    static String param(ConstraintDescriptor<?> descriptor) {
        Annotation annotation = descriptor.getAnnotation();
        if (annotation instanceof Rule rule) {
            return rule.param();
        }

        Map<String, Object> attributes = descriptor.getAttributes();
        for (String name : PARAM_ATTRIBUTES) {
            Object value = attributes.get(name);
            if (value == null || isSentinel(name, value)) {
                continue;
            }
            return value.toString();
        }
        return "";
    }

    /**
     * {@code @Size(max)} gibi özniteliklerin "sınır yok" anlamındaki varsayılan değerleri.
     */
    private static boolean isSentinel(String name, Object value) {
        if (value instanceof Integer i) {
            return i == Integer.MAX_VALUE || ("min".equals(name) && i == 0);
        }
        if (value instanceof Long l) {
            return l == Long.MAX_VALUE || ("min".equals(name) && l == 0L);
        }
        if (value instanceof String s) {
            return s.isEmpty() || ".*".equals(s);
        }
        return value.getClass().isArray();
    }

    static String toSnakeCase(String name) {
        var sb = new StringBuilder(name.length() + 4);
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (Character.isUpperCase(c) && i > 0) {
                char prev = name.charAt(i - 1);
                boolean nextLower = i + 1 < name.length() && Character.isLowerCase(name.charAt(i + 1));
                if (Character.isLowerCase(prev) || Character.isDigit(prev) || (Character.isUpperCase(prev) && nextLower)) {
                    sb.append('_');
                }
            }
            sb.append(Character.toLowerCase(c));
        }
        return sb.toString();
    }
}
