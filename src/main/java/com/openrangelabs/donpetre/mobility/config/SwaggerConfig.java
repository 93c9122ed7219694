package com.openrangelabs.donpetre.mobility.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Configuration for OpenAPI 3 / Swagger documentation.
 *
 * @author OpenRange Labs
 * @version 1.0
 * @since 2026-10
 */
@Configuration
public class SwaggerConfig {

    @Value("${server.port:8080}")
    private String serverPort;

    /**
     * Configures the OpenAPI specification for the mobility sync service.
     *
     * @return configured OpenAPI instance
     */
    @Bean
    public OpenAPI mobilitySyncOpenAPI() {
        return new OpenAPI()
                .info(apiInfo())
                .servers(List.of(new Server()
                        .url("http://localhost:" + serverPort)
                        .description("Local development server")))
                .addSecurityItem(new SecurityRequirement().addList("bearerAuth"))
                .components(new Components()
                        .addSecuritySchemes("bearerAuth", new SecurityScheme()
                                .type(SecurityScheme.Type.HTTP)
                                .scheme("bearer")
                                .bearerFormat("JWT")
                                .description("JWT token obtained from authentication service")));
    }

    private Info apiInfo() {
        return new Info()
                .title("DonPetre Mobility Sync API")
                .description("""
                # DonPetre Mobility Sync Service

                Pulls geofenced mobility pings from the data vendor for every area of interest
                in the city registry and lands them in the destination bucket under
                `data/{country}/{state}/{city}/date={YYYY-MM-DD}/`.

                ## Operations

                * **Runs**: start a sync for a date range and a set of endpoint/schema pairs,
                  then follow its chunk progress and final summary
                * **Coverage**: list the dates each location is still missing

                ## Security

                Reading requires the USER or ADMIN role, starting runs requires ADMIN.
                """)
                .version("1.0.0")
                .contact(new Contact()
                        .name("OpenRange Labs Development Team")
                        .email("dev@openrangelabs.com")
                        .url("https://openrangelabs.com"))
                .license(new License()
                        .name("Proprietary")
                        .url("https://openrangelabs.com/license"));
    }
}
