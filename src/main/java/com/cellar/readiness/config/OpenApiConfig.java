package com.cellar.readiness.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI cellarReadinessOpenAPI() {
        Server localServer = new Server();
        localServer.setUrl("http://localhost:8080");
        localServer.setDescription("Local Development Server");

        Info info = new Info()
                .title("Cellar Readiness API")
                .version("1.0.0")
                .description("Drink-window readiness for cellar wines, food pairing and tasting lineups, " +
                        "and the resumable readiness backfill.");

        return new OpenAPI()
                .info(info)
                .servers(List.of(localServer));
    }
}
