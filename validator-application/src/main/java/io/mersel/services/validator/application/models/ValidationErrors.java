package io.mersel.services.validator.application.models;

import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Bir doğrulama çağrısının sonucu: alan → kural → mesaj eşlemesi ve opsiyonel iç hata.
 * <p>
 * Aynı (alan, kural) çifti için tekrar eklenen mesaj öncekinin üzerine yazılır.
 * İç hata, motorun kural ihlali dışında bir nedenle başarısız olduğunu gösterir;
 * çağıranlar "geçerli" kararından önce {@link #hasInternalError()} kontrol etmelidir.
 * <p>
 * JSON gösterimi yalnızca doğrulama hatalarını içerir:
 * <pre>
 * {"name": {"required": "name alanı zorunludur"}}
 * </pre>
 * Thread-safe değildir; her doğrulama çağrısı kendi örneğini oluşturur.
 */
public class ValidationErrors {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Throwable internalError;
    private final Map<String, Map<String, String>> errors = new LinkedHashMap<>();

    private ValidationErrors(Throwable internalError) {
        this.internalError = internalError;
    }

    public static ValidationErrors empty() {
        return new ValidationErrors(null);
    }

    public static ValidationErrors ofInternalError(Throwable internalError) {
        return new ValidationErrors(internalError);
    }

    public boolean hasError() {
        return hasInternalError() || hasValidationErrors();
    }

    public boolean hasInternalError() {
        return internalError != null;
    }

    public boolean hasValidationErrors() {
        return !errors.isEmpty();
    }

    public boolean isFailed(String field) {
        return errors.containsKey(field);
    }

    public boolean isFailedOn(String field, String rule) {
        Map<String, String> rules = errors.get(field);
        return rules != null && rules.containsKey(rule);
    }

    /**
     * @return iç hata veya yoksa {@code null}
     */
    public Throwable getInternalError() {
        return internalError;
    }

    /**
     * Alan → kural → mesaj eşlemesinin değiştirilemez kopyası.
     */
    @JsonValue
    public Map<String, Map<String, String>> getErrors() {
        var copy = new LinkedHashMap<String, Map<String, String>>();
        errors.forEach((field, rules) -> copy.put(field, Collections.unmodifiableMap(new LinkedHashMap<>(rules))));
        return Collections.unmodifiableMap(copy);
    }

    /**
     * Her alan için mesaj listesi. Sıralama garanti edilmez.
     */
    public Map<String, List<String>> getMessages() {
        var messages = new LinkedHashMap<String, List<String>>();
        errors.forEach((field, rules) -> messages.put(field, List.copyOf(rules.values())));
        return messages;
    }

    /**
     * Her alan için başarısız kural adları. Sıralama garanti edilmez.
     */
    public Map<String, List<String>> getRules() {
        var result = new LinkedHashMap<String, List<String>>();
        errors.forEach((field, rules) -> result.put(field, new ArrayList<>(rules.keySet())));
        return result;
    }

    /**
     * (alan, kural) için mesaj kaydeder. Mesajın baş ve sondaki boşlukları atılır,
     * mesaj verilmezse boş string kullanılır.
     */
    public void addError(String field, String rule, String message) {
        errors.computeIfAbsent(field, f -> new LinkedHashMap<>())
                .put(rule, message != null ? message.strip() : "");
    }

    public void addError(String field, String rule) {
        addError(field, rule, "");
    }

    public String toJson() throws JsonProcessingException {
        return MAPPER.writeValueAsString(this);
    }

    @Override
    public String toString() {
        var sb = new StringBuilder();
        errors.forEach((field, rules) -> {
            sb.append(field).append(":\n");
            rules.forEach((rule, message) ->
                    sb.append("    ").append(rule).append(": ").append(message).append('\n'));
        });
        return sb.toString();
    }
}
