package io.mersel.services.validator.infrastructure.engine;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.mersel.services.validator.application.constraints.FieldName;
import io.mersel.services.validator.application.interfaces.IFieldNameResolver;

import java.lang.reflect.Field;

/**
 * Alan adını annotation'lardan çözer.
 * <p>
 * Öncelik sırası: {@link FieldName}, Jackson {@link JsonProperty}. Hiçbiri yoksa
 * {@code null} döner ve Java alan adı kullanılır. {@code "-"} değeri boş ad üretir.
 */
public class AnnotationFieldNameResolver implements IFieldNameResolver {

    private static final String IGNORED = "-";

    @Override
    public String resolve(Field field) {
        String name = null;

        FieldName fieldName = field.getAnnotation(FieldName.class);
        if (fieldName != null && !fieldName.value().isBlank()) {
            name = fieldName.value().strip();
        } else {
            JsonProperty jsonProperty = field.getAnnotation(JsonProperty.class);
            if (jsonProperty != null && !jsonProperty.value().isBlank()) {
                name = jsonProperty.value().strip();
            }
        }

        if (IGNORED.equals(name)) {
            return "";
        }
        return name;
    }
}
