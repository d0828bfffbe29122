package io.mersel.services.validator.application.models;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.mersel.services.validator.application.interfaces.ValidationEngineException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ValidationServiceResponse")
class ValidationServiceResponseTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    @DisplayName("basarili — result only, no error fields in JSON")
    void basarili() throws Exception {
        var response = ValidationServiceResponse.success("ok");

        assertThat(response.isFailure()).isFalse();
        assertThat(mapper.writeValueAsString(response)).isEqualTo("{\"result\":\"ok\"}");
    }

    @Test
    @DisplayName("bilinmeyen_kural — unknown_rule code with rule name in message")
    void bilinmeyen_kural() {
        ValidationServiceResponse<String> response = ValidationServiceResponse.unknownRule("iban2");

        assertThat(response.isFailure()).isTrue();
        assertThat(response.errorCode()).isEqualTo(ValidationServiceResponse.UNKNOWN_RULE);
        assertThat(response.errorMessage()).contains("iban2");
        assertThat(response.result()).isNull();
    }

    @Test
    @DisplayName("motor_hatasi — other internal errors map to engine_failure")
    void motor_hatasi() throws Exception {
        ValidationServiceResponse<String> response =
                ValidationServiceResponse.failure(new ValidationEngineException("Kural parametresi sayı olmalı: 'x'"));

        assertThat(response.errorCode()).isEqualTo(ValidationServiceResponse.ENGINE_FAILURE);
        assertThat(mapper.writeValueAsString(response))
                .isEqualTo("{\"errorCode\":\"engine_failure\",\"errorMessage\":\"Kural parametresi sayı olmalı: 'x'\"}");
    }
}
