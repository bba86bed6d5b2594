package com.jreinhal.concierge.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.parameters.HeaderParameter;
import io.swagger.v3.oas.models.media.StringSchema;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.oas.models.tags.Tag;
import java.util.List;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * OpenAPI/Swagger UI configuration. Interactive docs at /swagger-ui.html.
 */
@Configuration
public class OpenApiConfig {

    @Value("${spring.application.name:concierge}")
    private String appName;

    @Bean
    public OpenAPI conciergeOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Concierge HITL & Learning API")
                        .description("""
                                Human-in-the-loop approval queue and continuous-learning pipeline for %s.

                                Every tenant-scoped call needs the `X-Tenant-Id` header.
                                """.formatted(appName))
                        .version("1.0.0"))
                .components(new Components()
                        .addParameters("tenantHeader", new HeaderParameter()
                                .name("X-Tenant-Id")
                                .required(true)
                                .schema(new StringSchema())
                                .description("Tenant that owns the call")))
                .servers(List.of(new Server().url("/").description("Current Server")))
                .tags(List.of(
                        new Tag().name("HITL").description("Approval queue, reviewers and escalation rules"),
                        new Tag().name("Learning").description("Golden paths, activity graph and playbooks"),
                        new Tag().name("Activity").description("Per-tenant event stream"),
                        new Tag().name("Governance").description("Dashboards and compliance purge"),
                        new Tag().name("Tenants").description("Tenant provisioning and quotas")
                ));
    }
}
