package ch.lobbyhub.lobbybackend.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * API metadata shown in Swagger UI.
 *
 * <p>Only the REST discovery endpoints are documented here; the STOMP lobby
 * protocol lives under {@code /app/lobbies/**}.
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI lobbyOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Lobby Backend API")
                        .description("Game lobby discovery and inspection")
                        .version("v1.0.0"));
    }
}
