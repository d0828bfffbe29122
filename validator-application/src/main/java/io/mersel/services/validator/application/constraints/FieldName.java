package io.mersel.services.validator.application.constraints;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Hata kayıtlarında Java alan adı yerine kullanılacak adı belirler.
 * <p>
 * {@code "-"} değeri alanın adını boş bırakır.
 */
@Documented
@Target(ElementType.FIELD)
@Retention(RetentionPolicy.RUNTIME)
public @interface FieldName {

    String value();
}
