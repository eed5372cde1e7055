package uk.gegc.quotaledger.shared.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * API documentation groups and the HTTP Basic security scheme referenced by the controllers.
 */
@Configuration
public class OpenApiGroupConfig {

    @Bean
    public OpenAPI quotaLedgerOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("Quota Ledger API")
                        .version("v1")
                        .description("Per-user credit balances, metered usage sessions and batch refresh"))
                .components(new Components()
                        .addSecuritySchemes("basicAuth", new SecurityScheme()
                                .type(SecurityScheme.Type.HTTP)
                                .scheme("basic")));
    }

    @Bean
    public GroupedOpenApi quotaGroup() {
        return GroupedOpenApi.builder()
                .group("quota")
                .displayName("Quota")
                .pathsToMatch("/api/v1/quota/**")
                .build();
    }

    @Bean
    public GroupedOpenApi adminGroup() {
        return GroupedOpenApi.builder()
                .group("admin")
                .displayName("Quota Administration")
                .pathsToMatch("/api/v1/admin/**")
                .build();
    }
}
