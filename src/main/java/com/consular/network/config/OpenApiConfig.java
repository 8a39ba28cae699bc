package com.consular.network.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI networkAnalyticsOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Network Analytics API")
                        .version("1.0.0")
                        .description(
                                "Relationship and influence network analytics over consular records.\n\n" +
                                "**Analysis Pipeline:**\n" +
                                "1. Load one snapshot of people, organizations, memberships and annotations\n" +
                                "2. Index active memberships (dangling references are skipped)\n" +
                                "3. Build person and organization nodes with influence (0-100) and risk level\n" +
                                "4. Detect clusters of people sharing 2+ organizations with an anchor person\n" +
                                "5. Filter nodes by name and influence level, then aggregate stats\n\n" +
                                "**Influence levels:** `high` (>=80), `medium` (50-79), `low` (<50)\n\n" +
                                "Cluster detection is greedy and order-dependent (approximate clustering, " +
                                "not exact connected components). It always runs on the unfiltered snapshot.")
                        .contact(new Contact().name("Network Analytics Team")));
    }
}
