package io.mersel.services.validator.web;

import io.mersel.services.validator.infrastructure.config.InfrastructureConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Import;

/**
 * MERSEL i18n Validator - Ana uygulama giriş noktası.
 * <p>
 * Hibernate Validator motoru üzerinde yerelleştirilmiş doğrulama hata mesajları üreten servis.
 */
@SpringBootApplication
@Import(InfrastructureConfig.class)
public class ValidatorServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(ValidatorServiceApplication.class, args);
    }
}
