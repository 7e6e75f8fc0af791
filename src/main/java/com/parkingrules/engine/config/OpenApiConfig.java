package com.parkingrules.engine.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI (Swagger) configuration for API documentation.
 *
 * - Swagger UI: http://localhost:8080/swagger-ui.html
 * - OpenAPI JSON: http://localhost:8080/v3/api-docs
 */
@Configuration
public class OpenApiConfig {

    @Value("${server.port:8080}")
    private String serverPort;

    @Bean
    public OpenAPI parkingRulesOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Parking Rules API")
                        .description("Per-side street parking legality.\n\n" +
                                "## How answers are built\n\n" +
                                "1. Street centerlines are split into a Left and a Right segment\n" +
                                "2. Regulation lines, sweeping schedules and meters are joined to segment sides\n" +
                                "3. A legality query evaluates the merged rules of one side against a time and duration\n\n" +
                                "## Precedence\n\n" +
                                "- Tow-away, street sweeping and no-parking block parking outright\n" +
                                "- RPP visitor allowances and time limits cap the duration\n" +
                                "- Meters only add a cost\n\n" +
                                "Always check the signs on site: the source datasets are themselves imperfect.")
                        .version("1.0.0"))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local Development Server")
                ));
    }
}
