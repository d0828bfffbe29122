package io.mersel.services.validator.web;

import io.mersel.services.validator.application.interfaces.ILocalizedValidator;
import io.mersel.services.validator.application.interfaces.IValidationEngine;
import io.mersel.services.validator.application.interfaces.UnknownRuleException;
import io.mersel.services.validator.application.models.ValidationErrors;
import io.mersel.services.validator.web.controllers.ValidationController;
import io.mersel.services.validator.web.infrastructure.GlobalExceptionHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.Set;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * ValidationController birim testleri.
 * <p>
 * Dil çözümleme ve doğrulama sonucunun HTTP yanıtına dönüşümünü test eder.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("POST /v1/validate")
class ValidationControllerTest {

    private MockMvc mockMvc;

    @Mock
    private ILocalizedValidator validator;

    @Mock
    private IValidationEngine engine;

    @InjectMocks
    private ValidationController validationController;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(validationController)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    private static ValidationErrors requiredError(String field, String message) {
        var errors = ValidationErrors.empty();
        errors.addError(field, "required", message);
        return errors;
    }

    @Test
    @DisplayName("Kural ihlali valid=false ve çevrilmiş mesajla dönmeli")
    void shouldReturnTranslatedErrors() throws Exception {
        when(validator.var(eq("fa"), eq("mobile"), eq(""), eq("required,mobile")))
                .thenReturn(requiredError("mobile", "mobile الزامی است"));

        mockMvc.perform(post("/v1/validate")
                        .param("locale", "fa")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"mobile\",\"value\":\"\",\"rules\":\"required,mobile\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.result.valid").value(false))
                .andExpect(jsonPath("$.result.locale").value("fa"))
                .andExpect(jsonPath("$.result.errors.mobile.required").value("mobile الزامی است"));
    }

    @Test
    @DisplayName("Geçerli değer valid=true dönmeli, dil Accept-Language'den alınmalı")
    void shouldUseAcceptLanguage() throws Exception {
        when(validator.var(eq("tr-tr"), eq("name"), eq("Ali"), eq("required")))
                .thenReturn(ValidationErrors.empty());

        mockMvc.perform(post("/v1/validate")
                        .header("Accept-Language", "tr-TR,tr;q=0.9,en;q=0.8")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"name\",\"value\":\"Ali\",\"rules\":\"required\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.result.valid").value(true))
                .andExpect(jsonPath("$.result.locale").value("tr-tr"));
    }

    @Test
    @DisplayName("other alanı varsa varWithValue kullanılmalı")
    void shouldUseVarWithValueWhenOtherPresent() throws Exception {
        when(validator.varWithValue(eq("en"), eq("password"), eq("a"), eq("b"), eq("eqfield")))
                .thenReturn(ValidationErrors.empty());

        mockMvc.perform(post("/v1/validate?locale=en")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"password\",\"value\":\"a\",\"other\":\"b\",\"rules\":\"eqfield\"}"))
                .andExpect(status().isOk());

        verify(validator, never()).var(anyString(), anyString(), any(), anyString());
    }

    @Test
    @DisplayName("Motor hatası 400 ve hata mesajı dönmeli")
    void shouldReturnBadRequestOnInternalError() throws Exception {
        when(validator.var(anyString(), anyString(), any(), anyString()))
                .thenReturn(ValidationErrors.ofInternalError(new UnknownRuleException("nope")));

        mockMvc.perform(post("/v1/validate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"x\",\"value\":\"y\",\"rules\":\"nope\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("unknown_rule"))
                .andExpect(jsonPath("$.errorMessage").value("Tanımsız doğrulama kuralı: 'nope'"))
                .andExpect(jsonPath("$.result").doesNotExist());
    }

    @Test
    @DisplayName("Eksik alanlar ProblemDetail ile 400 dönmeli")
    void shouldRejectInvalidRequest() throws Exception {
        mockMvc.perform(post("/v1/validate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"value\":\"y\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.title").value("Doğrulama Hatası"));
    }

    @Test
    @DisplayName("Format kuralı tek başına denetlenebilmeli")
    void shouldValidateSingleFormatRule() throws Exception {
        when(engine.getRuleNames()).thenReturn(Set.of("national_code"));
        var errors = ValidationErrors.empty();
        errors.addError("national_code", "national_code", "invalid");
        when(validator.var(eq(""), eq("national_code"), eq("0499370898"), eq("national_code"))).thenReturn(errors);

        mockMvc.perform(post("/v1/validate/format/national_code").param("value", "0499370898"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.result.valid").value(false))
                .andExpect(jsonPath("$.result.errors.national_code.national_code").value("invalid"));
    }

    @Test
    @DisplayName("Bilinmeyen format kuralı 404 dönmeli")
    void shouldReturnNotFoundForUnknownRule() throws Exception {
        when(engine.getRuleNames()).thenReturn(Set.of("iban"));

        mockMvc.perform(post("/v1/validate/format/nope").param("value", "x"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.errorCode").value("unknown_rule"));
    }
}
