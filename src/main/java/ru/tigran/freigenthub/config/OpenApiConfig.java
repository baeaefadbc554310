package ru.tigran.freigenthub.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * OpenAPI 3.0 configuration for Swagger UI documentation.
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI customOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Freigent Hub API")
                        .description("REST API для профилей Freigent-агентов, A2A сообщений через хаб " +
                                "и мульти-агентного поиска товаров.")
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("Tigran")
                                .url("https://github.com/TIGERVENENO")
                        )
                );
    }
}
