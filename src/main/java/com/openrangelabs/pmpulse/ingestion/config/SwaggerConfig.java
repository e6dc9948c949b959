package com.openrangelabs.pmpulse.ingestion.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI documentation for the sync, connection and alert endpoints.
 *
 * @author OpenRange Labs
 * @version 1.0
 * @since 2025-01
 */
@Configuration
public class SwaggerConfig {

    @Value("${server.port:8080}")
    private String serverPort;

    @Bean
    public OpenAPI pmPulseIngestionOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("PMPulse Ingestion API")
                        .description("""
                        Synchronizes properties, units, leases, work orders, vendors and expenses
                        from the property-management API into the local store.

                        * Manual full or incremental sync per connection
                        * Run history with per-resource metrics
                        * Consecutive-failure alerts with acknowledgment
                        """)
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("OpenRange Labs Development Team")
                                .email("dev@openrangelabs.com")))
                .servers(List.of(new Server()
                        .url("http://localhost:" + serverPort)
                        .description("Local development server")))
                .addSecurityItem(new SecurityRequirement().addList("bearerAuth"))
                .components(new Components()
                        .addSecuritySchemes("bearerAuth", new SecurityScheme()
                                .type(SecurityScheme.Type.HTTP)
                                .scheme("bearer")
                                .bearerFormat("JWT")));
    }
}
