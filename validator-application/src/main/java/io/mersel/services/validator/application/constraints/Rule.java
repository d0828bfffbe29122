package io.mersel.services.validator.application.constraints;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Repeatable;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Kural kayıt defterindeki adlandırılmış bir kuralı bir alana bağlar.
 * <p>
 * Doğrulayıcı sınıfı derleme zamanında değil, motor tarafından programatik
 * olarak tanımlanır; bu yüzden {@code validatedBy} boştur.
 * <pre>
 * public record Customer(
 *         &#64;Rule("required") &#64;Rule("national_code") String nationalCode,
 *         &#64;Rule(value = "min", param = "3") String name) {
 * }
 * </pre>
 */
@Documented
@Constraint(validatedBy = {})
@Target({ElementType.FIELD, ElementType.METHOD, ElementType.PARAMETER, ElementType.ANNOTATION_TYPE})
@Retention(RetentionPolicy.RUNTIME)
@Repeatable(Rule.List.class)
public @interface Rule {

    /**
     * Kayıtlı kural adı.
     */
    String value();

    /**
     * Kural parametresi (örn: {@code min} için "3").
     */
    String param() default "";

    String message() default "failed on the '{value}' rule";

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};

    @Documented
    @Target({ElementType.FIELD, ElementType.METHOD, ElementType.PARAMETER, ElementType.ANNOTATION_TYPE})
    @Retention(RetentionPolicy.RUNTIME)
    @interface List {
        Rule[] value();
    }
}
