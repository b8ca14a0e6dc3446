package com.commerce.sync.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI inventorySyncOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Inventory Sync Service API")
                        .description("Manual triggers and diagnostics for keeping inventory quantities and prices consistent between the source and target commerce platforms.")
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("Commerce Platform Team")
                                .email("commerce-platform@example.com"))
                        .license(new License()
                                .name("MIT License")
                                .url("https://opensource.org/licenses/MIT")))
                .servers(List.of(
                        new Server().url("http://localhost:8080").description("Development server")
                ));
    }
}
