package io.mersel.services.validator.web.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI dokümantasyon yapılandırması.
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI validatorServiceOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("MERSEL i18n Validator API")
                        .description("""
                                Hibernate Validator üzerinde yerelleştirilmiş doğrulama hata mesajları üreten servis.
                                
                                ## Özellikler
                                - **Kural İfadeleri**: `required,min=3` biçiminde virgülle ayrılmış kurallar
                                - **Çok Dilli Mesajlar**: YAML kataloğundan dil ve çoğul biçim destekli mesajlar
                                - **Format Denetleyiciler**: Telefon, ulusal kimlik kodu, kart numarası, IBAN, Jalaali tarih, IP
                                """)
                        .version("1.0.0")
                        .license(new License()
                                .name("MIT"))
                        .contact(new Contact()
                                .name("Mersel")
                                .url("https://mersel.io")))
                .servers(List.of(
                        new Server().url("/").description("Yerel sunucu")
                ));
    }
}
