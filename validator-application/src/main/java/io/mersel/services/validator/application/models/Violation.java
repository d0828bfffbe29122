package io.mersel.services.validator.application.models;

/**
 * Doğrulama motorunun ürettiği tek bir kural ihlali kaydı.
 *
 * @param field       Hata kaydında kullanılacak alan adı ({@code @FieldName} / {@code @JsonProperty} çözümlenmiş)
 * @param structField Java alan adı. Değişken doğrulamada boştur.
 * @param rule        Başarısız olan kural adı (örn: "required", "min", "not_blank")
 * @param param       Kural parametresi string olarak (parametresiz kurallarda boş)
 * @param message     Motorun varsayılan (çevrilmemiş) mesajı
 */
public record Violation(
        String field,
        String structField,
        String rule,
        String param,
        String message
) {

    public Violation {
        field = field != null ? field : "";
        structField = structField != null ? structField : "";
        rule = rule != null ? rule : "";
        param = param != null ? param : "";
        message = message != null ? message : "";
    }
}
