package io.mersel.services.validator.infrastructure.engine;

import io.mersel.services.validator.application.interfaces.ValidationEngineException;

import java.util.ArrayList;
import java.util.List;

/**
 * Virgülle ayrılmış kural ifadelerini ayrıştırır.
 * <p>
 * Biçim: {@code kural[=parametre](,kural[=parametre])*}. Parametre içinde
 * virgül için {@code 0x2C}, dikey çizgi için {@code 0x7C} kaçışı kullanılır.
 * <pre>
 * "required,min=3,oneof=a b c" → [required], [min, 3], [oneof, "a b c"]
 * </pre>
 */
final class RuleExpressionParser {

    private static final String COMMA_ESCAPE = "0x2C";
    private static final String PIPE_ESCAPE = "0x7C";

    private RuleExpressionParser() {}

    /**
     * @return kural çağrıları; ifade boşsa boş liste
     * @throws ValidationEngineException boş kural segmenti veya boş kural adı varsa
     */
    static List<RuleCall> parse(String expression) {
        if (expression == null || expression.isBlank()) {
            return List.of();
        }

        var calls = new ArrayList<RuleCall>();
        for (String segment : expression.split(",", -1)) {
            String trimmed = segment.strip();
            if (trimmed.isEmpty()) {
                throw new ValidationEngineException("Geçersiz kural ifadesi (boş segment): '" + expression + "'");
            }

            int eq = trimmed.indexOf('=');
            String name = eq < 0 ? trimmed : trimmed.substring(0, eq).strip();
            String param = eq < 0 ? "" : unescape(trimmed.substring(eq + 1));
            if (name.isEmpty()) {
                throw new ValidationEngineException("Geçersiz kural ifadesi (kural adı yok): '" + expression + "'");
            }
            calls.add(new RuleCall(name, param));
        }
        return calls;
    }

    private static String unescape(String param) {
        return param.replace(COMMA_ESCAPE, ",").replace(PIPE_ESCAPE, "|");
    }
}
