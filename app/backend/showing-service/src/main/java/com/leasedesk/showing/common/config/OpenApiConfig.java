package com.leasedesk.showing.common.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI settings. The server URL points at the gateway path the service is published under.
 */
@Configuration
public class OpenApiConfig {

    @Value("${springdoc.server.url:/api}")
    private String serverUrl;

    @Bean
    public OpenAPI customOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Showing Service API")
                        .version("1.0.0")
                        .description("Leasing agent lookup and showing availability API"))
                .servers(List.of(
                        new Server()
                                .url(serverUrl)
                                .description("API Gateway")
                ));
    }
}
