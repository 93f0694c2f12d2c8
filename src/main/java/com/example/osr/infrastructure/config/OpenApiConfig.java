package com.example.osr.infrastructure.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI/Swagger configuration.
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI osrOrderServiceOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("OSR Order Service API")
                        .description("""
                                Compose, transmit and track orders for the OSR order/stock-retrieval system.

                                ## Order lifecycle

                                `PENDING → SENT → {COMPLETED, CANCELLED}`, with `FAILED` on rejection or
                                exhausted retries and `UNKNOWN` when a status check cannot reach the OSR.

                                ## Supported order kinds

                                - **STANDARD**: pick into a container
                                - **MANUAL**: manual pick
                                - **INVENTORY**: stock count of one product in a container
                                - **GOODS_IN**: goods receipt into a compartment
                                - **GOODS_ADD**: goods receipt in renewal mode
                                """)
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("Warehouse Integration Team")
                                .email("osr-integration@example.com"))
                        .license(new License()
                                .name("Apache 2.0")
                                .url("https://www.apache.org/licenses/LICENSE-2.0")))
                .servers(List.of(
                        new Server().url("http://localhost:8080").description("Local Development")
                ));
    }
}
