package io.mersel.services.validator.web.infrastructure;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.BindException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.net.URI;
import java.util.stream.Collectors;

/**
 * Global hata yöneticisi (RFC 7807 Problem Details).
 * <p>
 * Tüm controller'lardan çıkan istisnaları tutarlı bir JSON formatta döner:
 * <pre>
 * {
 *   "type": "https://mersel.io/i18n-validator/errors/validation-error",
 *   "title": "Doğrulama Hatası",
 *   "status": 400,
 *   "detail": "name: Alan adı boş olamaz"
 * }
 * </pre>
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);
    private static final String ERROR_BASE_URI = "https://mersel.io/i18n-validator/errors/";

    /**
     * Genel istek hatası → 400 Bad Request.
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Geçersiz parametre: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, ex.getMessage(), "bad-request", "Geçersiz İstek");
    }

    /**
     * Okunamayan istek gövdesi (bozuk JSON) → 400 Bad Request.
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ProblemDetail handleNotReadable(HttpMessageNotReadableException ex) {
        log.warn("İstek gövdesi okunamadı: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "İstek gövdesi geçerli bir JSON değil", "malformed-request", "Geçersiz İstek");
    }

    /**
     * Eksik zorunlu parametre → 400 Bad Request.
     */
    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ProblemDetail handleMissingParameter(MissingServletRequestParameterException ex) {
        log.warn("Eksik parametre: {}", ex.getParameterName());
        return problem(HttpStatus.BAD_REQUEST, "Zorunlu parametre eksik: " + ex.getParameterName(),
                "bad-request", "Geçersiz İstek");
    }

    /**
     * Bean Validation hatası → 400 Bad Request.
     * Jakarta @Valid / @NotBlank / @Size gibi annotation hataları.
     * {@code MethodArgumentNotValidException} da bu sınıftan türer.
     */
    @ExceptionHandler(BindException.class)
    public ProblemDetail handleBindException(BindException ex) {
        String detail = ex.getFieldErrors().stream()
                .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                .collect(Collectors.joining("; "));
        log.warn("Doğrulama hatası: {}", detail);
        return problem(HttpStatus.BAD_REQUEST, detail, "validation-error", "Doğrulama Hatası");
    }

    /**
     * Beklenmeyen hata → 500 Internal Server Error.
     */
    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGenericException(Exception ex) {
        log.error("Beklenmeyen hata: {}", ex.getMessage(), ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "Beklenmeyen bir hata oluştu. Lütfen tekrar deneyin.",
                "internal-error", "Sunucu Hatası");
    }

    private static ProblemDetail problem(HttpStatus status, String detail, String type, String title) {
        var problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setType(URI.create(ERROR_BASE_URI + type));
        problem.setTitle(title);
        return problem;
    }
}
