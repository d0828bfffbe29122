package io.mersel.services.validator.infrastructure.rules;

import io.mersel.services.validator.application.interfaces.RulePredicate;
import io.mersel.services.validator.application.interfaces.UnknownRuleException;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Adlandırılmış doğrulama kuralları kayıt defteri.
 * <p>
 * Kurallar başlangıçta bir kez kaydedilir, doğrulama sırasında yalnızca okunur.
 * Aynı adla tekrar kayıt öncekinin üzerine yazar.
 */
public class RuleRegistry {

    private final Map<String, RulePredicate> rules = new ConcurrentHashMap<>();

    /**
     * Yerleşik kurallar ({@code required}, {@code min}, {@code max} ...) kayıtlı bir kayıt defteri oluşturur.
     */
    public static RuleRegistry withBuiltins() {
        var registry = new RuleRegistry();
        BuiltinRules.registerAll(registry);
        return registry;
    }

    public void register(String rule, RulePredicate predicate) {
        Objects.requireNonNull(predicate, "predicate");
        if (rule == null || rule.isBlank()) {
            throw new IllegalArgumentException("Kural adı boş olamaz");
        }
        rules.put(rule.strip(), predicate);
    }

    public Optional<RulePredicate> find(String rule) {
        return rule == null ? Optional.empty() : Optional.ofNullable(rules.get(rule));
    }

    /**
     * @throws UnknownRuleException kural kayıtlı değilse
     */
    public RulePredicate get(String rule) {
        return find(rule).orElseThrow(() -> new UnknownRuleException(rule));
    }

    public boolean contains(String rule) {
        return rule != null && rules.containsKey(rule);
    }

    /**
     * Alfabetik sıralı kural adları.
     */
    public Set<String> names() {
        return Collections.unmodifiableSet(new TreeSet<>(rules.keySet()));
    }
}
