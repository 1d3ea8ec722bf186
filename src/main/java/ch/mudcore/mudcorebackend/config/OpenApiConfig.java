package ch.mudcore.mudcorebackend.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * OpenAPI metadata shown in Swagger UI for the admin endpoints.
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI mudCoreOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("MudCore Identity API")
                        .description("Player records, live sessions and storage administration of the MUD server")
                        .version("v1.0.0"));
    }
}
