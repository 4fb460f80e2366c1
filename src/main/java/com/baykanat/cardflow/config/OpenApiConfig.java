package com.baykanat.cardflow.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/** OpenAPI / Swagger UI bean tanımı. */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI cardflowOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("Cardflow - Card Lifecycle & Notification API")
                        .description("""
                                Multi-tenant card tracking core: lifecycle transitions, automatic \
                                postponement of inactive cards (entropy) and windowed notification \
                                bundles. Tenant and actor are supplied by the gateway via the \
                                X-Tenant-Id, X-Actor-Id and X-Actor-Role headers.\
                                """)
                        .version("1.0.0"))
                .servers(List.of(
                        new Server().url("http://localhost:8080").description("Local Development")
                ));
    }
}
