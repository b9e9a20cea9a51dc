package com.openrangelabs.blacklist.collector.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI 3 documentation for the collection endpoints.
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
    public OpenAPI blacklistCollectorOpenAPI() {
        return new OpenAPI()
                .info(apiInfo())
                .servers(List.of(new Server()
                        .url("http://localhost:" + serverPort)
                        .description("Local development server")));
    }

    private Info apiInfo() {
        return new Info()
                .title("Blacklist Collector API")
                .description("""
                # Blacklist Collector

                Collects threat intelligence IP records from external portals on a
                per-source schedule.

                ## Endpoints

                * **Status**: scheduling state, backoff and rate limit status per source
                * **Trigger**: manual collection for a source, optionally for a date range
                * **History**: recent collection runs for a source
                """)
                .version("1.0.0")
                .contact(new Contact()
                        .name("OpenRange Labs Development Team")
                        .email("dev@openrangelabs.com")
                        .url("https://openrangelabs.com"));
    }
}
