package io.mersel.services.validator.application.interfaces;

import java.lang.reflect.Field;

/**
 * Bir bean alanının hata kayıtlarında görünecek adını çözer.
 */
@FunctionalInterface
public interface IFieldNameResolver {

    /**
     * @param field Java alanı
     * @return Alan adı; {@code null} ise Java alan adı kullanılır
     */
    String resolve(Field field);
}
