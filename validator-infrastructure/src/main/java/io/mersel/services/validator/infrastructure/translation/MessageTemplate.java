package io.mersel.services.validator.infrastructure.translation;

import java.math.BigDecimal;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@code {ad}} biçimindeki yer tutucuları değerleriyle değiştirir.
 * <p>
 * Tanınmayan yer tutucular olduğu gibi bırakılır. Tam sayı değerli
 * ondalıklar ".0" olmadan yazılır ({@code 5.0} → {@code 5}).
 */
final class MessageTemplate {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([A-Za-z0-9_.-]+)}");

    private MessageTemplate() {}

    static String format(String template, Map<String, Object> params) {
        if (template == null || template.isEmpty()) {
            return "";
        }
        if (params == null || params.isEmpty()) {
            return template;
        }

        Matcher matcher = PLACEHOLDER.matcher(template);
        var sb = new StringBuilder(template.length() + 16);
        while (matcher.find()) {
            String name = matcher.group(1);
            String replacement = params.containsKey(name) ? render(params.get(name)) : matcher.group();
            matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    static String render(Object value) {
        if (value == null) {
            return "";
        }
        if ((value instanceof Double || value instanceof Float) && Double.isFinite(((Number) value).doubleValue())) {
            return BigDecimal.valueOf(((Number) value).doubleValue()).stripTrailingZeros().toPlainString();
        }
        return value.toString();
    }
}
