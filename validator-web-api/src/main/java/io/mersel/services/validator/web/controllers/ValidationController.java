package io.mersel.services.validator.web.controllers;

import io.mersel.services.validator.application.interfaces.ILocalizedValidator;
import io.mersel.services.validator.application.interfaces.IValidationEngine;
import io.mersel.services.validator.application.models.ValidationErrors;
import io.mersel.services.validator.application.models.ValidationServiceResponse;
import io.mersel.services.validator.web.dto.VariableValidationRequestDto;
import io.mersel.services.validator.web.dto.VariableValidationResult;
import io.mersel.services.validator.web.infrastructure.RequestLocales;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Tek değer doğrulama endpoint'leri.
 * <p>
 * Hata mesajlarının dili {@code locale} parametresi veya {@code Accept-Language}
 * başlığından çözülür. Kural ihlalleri HTTP 200 ile {@code valid=false} olarak,
 * motor hataları (bilinmeyen kural, bozuk ifade) HTTP 400 olarak döner.
 */
@RestController
@RequestMapping("/v1")
@Tag(name = "Validation", description = "Yerelleştirilmiş değer doğrulama işlemleri")
public class ValidationController {

    private static final Logger log = LoggerFactory.getLogger(ValidationController.class);

    private final ILocalizedValidator validator;
    private final IValidationEngine engine;

    public ValidationController(ILocalizedValidator validator, IValidationEngine engine) {
        this.validator = validator;
        this.engine = engine;
    }

    @Operation(
            summary = "Değer Doğrulama",
            description = """
                    Tek bir değeri virgülle ayrılmış kural ifadesine göre doğrular ve hata mesajlarını istenen dilde döner.
                    
                    **Örnek kurallar:** `required`, `min=3`, `max=10`, `oneof=a b c`, `mobile`, `national_code`, `iban`
                    
                    **Karşılaştırma:** `eqfield` / `nefield` kuralları `other` alanı ile karşılaştırılır.
                    
                    **omitempty:** Değer boşsa kalan kurallar atlanır.
                    """
    )
    @PostMapping(value = "/validate", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ValidationServiceResponse<VariableValidationResult>> validate(
            @RequestBody @Valid VariableValidationRequestDto requestDto,
            @RequestParam(value = "locale", required = false) String localeParam,
            @RequestHeader(value = HttpHeaders.ACCEPT_LANGUAGE, required = false) String acceptLanguage) {

        String locale = RequestLocales.resolve(localeParam, acceptLanguage);
        log.debug("Doğrulama isteği: alan={}, kurallar={}, dil='{}'", requestDto.getName(), requestDto.getRules(), locale);

        ValidationErrors errors = requestDto.getOther() == null
                ? validator.var(locale, requestDto.getName(), requestDto.getValue(), requestDto.getRules())
                : validator.varWithValue(locale, requestDto.getName(), requestDto.getValue(),
                        requestDto.getOther(), requestDto.getRules());

        return toResponse(locale, errors);
    }

    @Operation(
            summary = "Tek Kural Denetimi",
            description = "Değeri kayıtlı tek bir kurala göre denetler (örn: `national_code`, `iban`, `mobile`)."
    )
    @PostMapping("/validate/format/{rule}")
    public ResponseEntity<ValidationServiceResponse<VariableValidationResult>> validateFormat(
            @PathVariable("rule") String rule,
            @RequestParam("value") String value,
            @RequestParam(value = "name", required = false) String name,
            @RequestParam(value = "locale", required = false) String localeParam,
            @RequestHeader(value = HttpHeaders.ACCEPT_LANGUAGE, required = false) String acceptLanguage) {

        if (!engine.getRuleNames().contains(rule)) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(ValidationServiceResponse.unknownRule(rule));
        }

        String locale = RequestLocales.resolve(localeParam, acceptLanguage);
        String field = name == null || name.isBlank() ? rule : name;
        return toResponse(locale, validator.var(locale, field, value, rule));
    }

    private static ResponseEntity<ValidationServiceResponse<VariableValidationResult>> toResponse(
            String locale, ValidationErrors errors) {
        if (errors.hasInternalError()) {
            log.warn("Doğrulama yapılamadı: {}", errors.getInternalError().getMessage());
            return ResponseEntity.badRequest()
                    .body(ValidationServiceResponse.failure(errors.getInternalError()));
        }
        return ResponseEntity.ok(ValidationServiceResponse.success(VariableValidationResult.of(locale, errors)));
    }
}
