package tech.noetzold.guardrail_api.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import io.swagger.v3.oas.models.tags.Tag;
import io.swagger.v3.oas.models.Components;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class SwaggerConfig {

    private static final List<String> IDENTITY_HEADERS = List.of(
            "x-user-role", "x-user-orgunit", "x-user-geo", "x-ticket-id", "x-justification");

    @Bean
    public OpenAPI customOpenAPI() {
        Components components = new Components();
        SecurityRequirement requirement = new SecurityRequirement();
        for (String header : IDENTITY_HEADERS) {
            components.addSecuritySchemes(header, new SecurityScheme()
                    .type(SecurityScheme.Type.APIKEY)
                    .in(SecurityScheme.In.HEADER)
                    .name(header));
            requirement.addList(header);
        }

        return new OpenAPI()
                .info(new Info()
                        .title("Role-First Guardrail API")
                        .version("1.0.0")
                        .description("Role/attribute gate evaluated on the classified intent before any LLM call")
                        .contact(new Contact()
                                .name("Noetzold Tech")
                                .email("contato@noetzold.tech")
                                .url("https://noetzold.tech"))
                        .license(new License()
                                .name("Apache 2.0")
                                .url("https://www.apache.org/licenses/LICENSE-2.0.html")))
                .components(components)
                .addSecurityItem(requirement)
                .tags(List.of(
                        new Tag().name("Chat").description("Guarded chat endpoint"),
                        new Tag().name("Policy").description("Active policy and reload"),
                        new Tag().name("Health").description("Liveness and readiness")));
    }
}
