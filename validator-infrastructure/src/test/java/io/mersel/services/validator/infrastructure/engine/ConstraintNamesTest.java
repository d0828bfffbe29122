package io.mersel.services.validator.infrastructure.engine;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ConstraintNames")
class ConstraintNamesTest {

    @ParameterizedTest(name = "{0} → {1}")
    @CsvSource({
            "NotBlank, not_blank",
            "NotNull, not_null",
            "Size, size",
            "Email, email",
            "PositiveOrZero, positive_or_zero",
            "DecimalMin, decimal_min",
            "URL, url",
            "ISBN13, isbn13",
            "CNPJ, cnpj",
            "UUIDValue, uuid_value"
    })
    void snake_case(String annotation, String expected) {
        assertThat(ConstraintNames.toSnakeCase(annotation)).isEqualTo(expected);
    }
}
