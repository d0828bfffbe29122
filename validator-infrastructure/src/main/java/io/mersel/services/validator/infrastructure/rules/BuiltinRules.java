package io.mersel.services.validator.infrastructure.rules;

import io.mersel.services.validator.application.interfaces.ValidationEngineException;
import io.mersel.services.validator.application.models.RuleContext;

import java.lang.reflect.Array;
import java.util.Arrays;
import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.DoublePredicate;
import java.util.regex.Pattern;

/**
 * Her kayıt defterine eklenen yerleşik kurallar.
 * <p>
 * Boyut karşılaştırmaları (min, max, len, gt, gte, lt, lte) string'lerde karakter
 * (code point) sayısını, koleksiyon/map/dizilerde eleman sayısını, sayılarda
 * değerin kendisini kullanır. {@code null} değer boyut kurallarını sağlamaz.
 */
public final class BuiltinRules {

    private static final Pattern EMAIL = Pattern.compile(
            "^[A-Za-z0-9.!#$%&'*+/=?^_`{|}~-]+@[A-Za-z0-9](?:[A-Za-z0-9-]{0,61}[A-Za-z0-9])?(?:\\.[A-Za-z0-9](?:[A-Za-z0-9-]{0,61}[A-Za-z0-9])?)+$");
    private static final Pattern ALPHA = Pattern.compile("^[a-zA-Z]+$");
    private static final Pattern NUMERIC = Pattern.compile("^[-+]?[0-9]+(?:\\.[0-9]+)?$");

    /**
     * Parametresi aynı nesnedeki kardeş alanın adı olan kurallar.
     * Bean doğrulamada karşılaştırma değeri motor tarafından bu alandan okunur.
     */
    public static final Set<String> FIELD_COMPARISON_RULES = Set.of("eqfield", "nefield");

    private BuiltinRules() {}

    static void registerAll(RuleRegistry registry) {
        registry.register("required", ctx -> isPresent(ctx.value()));

        registry.register("min", ctx -> compareSize(ctx, size -> size >= number(ctx)));
        registry.register("max", ctx -> compareSize(ctx, size -> size <= number(ctx)));
        registry.register("len", ctx -> compareSize(ctx, size -> size == number(ctx)));
        registry.register("gt", ctx -> compareSize(ctx, size -> size > number(ctx)));
        registry.register("gte", ctx -> compareSize(ctx, size -> size >= number(ctx)));
        registry.register("lt", ctx -> compareSize(ctx, size -> size < number(ctx)));
        registry.register("lte", ctx -> compareSize(ctx, size -> size <= number(ctx)));

        registry.register("eq", BuiltinRules::isEqualToParam);
        registry.register("ne", ctx -> !isEqualToParam(ctx));
        registry.register("oneof", ctx -> ctx.value() != null
                && Arrays.asList(ctx.param().strip().split("\\s+")).contains(ctx.valueAsString()));

        registry.register("eqfield", ctx -> isEqual(ctx.value(), ctx.other()));
        registry.register("nefield", ctx -> !isEqual(ctx.value(), ctx.other()));

        registry.register("email", ctx -> ctx.value() != null && EMAIL.matcher(ctx.valueAsString()).matches());
        registry.register("alpha", ctx -> ctx.value() != null && ALPHA.matcher(ctx.valueAsString()).matches());
        registry.register("numeric", ctx -> ctx.value() != null && NUMERIC.matcher(ctx.valueAsString()).matches());
    }

    /**
     * Değerin "boş" olmadığını kontrol eder: {@code null} değil, boş string/koleksiyon/map/dizi değil.
     */
    public static boolean isPresent(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof CharSequence s) {
            return s.length() > 0;
        }
        if (value instanceof Collection<?> c) {
            return !c.isEmpty();
        }
        if (value instanceof Map<?, ?> m) {
            return !m.isEmpty();
        }
        if (value instanceof Optional<?> o) {
            return o.isPresent();
        }
        if (value.getClass().isArray()) {
            return Array.getLength(value) > 0;
        }
        return true;
    }

    static double sizeOf(Object value) {
        if (value instanceof CharSequence s) {
            return s.toString().codePointCount(0, s.length());
        }
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        if (value instanceof Collection<?> c) {
            return c.size();
        }
        if (value instanceof Map<?, ?> m) {
            return m.size();
        }
        if (value.getClass().isArray()) {
            return Array.getLength(value);
        }
        throw new ValidationEngineException("Boyut kuralı bu tip için tanımlı değil: " + value.getClass().getName());
    }

    private static boolean compareSize(RuleContext ctx, DoublePredicate check) {
        return ctx.value() != null && check.test(sizeOf(ctx.value()));
    }

    private static double number(RuleContext ctx) {
        try {
            return Double.parseDouble(ctx.param().strip());
        } catch (NumberFormatException e) {
            throw new ValidationEngineException("Kural parametresi sayı olmalı: '" + ctx.param() + "'", e);
        }
    }

    private static boolean isEqualToParam(RuleContext ctx) {
        Object value = ctx.value();
        if (value == null) {
            return false;
        }
        if (value instanceof CharSequence || value instanceof Character || value instanceof Boolean || value instanceof Enum<?>) {
            return value.toString().equals(ctx.param());
        }
        return sizeOf(value) == number(ctx);
    }

    private static boolean isEqual(Object value, Object other) {
        if (value instanceof Number a && other instanceof Number b) {
            return Double.compare(a.doubleValue(), b.doubleValue()) == 0;
        }
        return Objects.equals(value, other);
    }
}
