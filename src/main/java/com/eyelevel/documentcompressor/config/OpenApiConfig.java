package com.eyelevel.documentcompressor.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.info.BuildProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;

import java.util.Optional;

@Configuration
@Profile("!prod")
@RequiredArgsConstructor
public class OpenApiConfig {

    private final Optional<BuildProperties> buildProperties;

    @Bean
    public OpenAPI customOpenAPI() {
        String version = buildProperties.map(BuildProperties::getVersion).orElse("<NOT_FOUND>");
        String appName = buildProperties.map(BuildProperties::getName).orElse("Document Compressor API");

        return new OpenAPI()
                .info(new Info().title(appName)
                        .version(version)
                        .description("""
                                Background compression for stored media documents.
                                Documents are registered and queued for compression, then picked up by a pool of
                                workers that apply the compression policy configured for their document type.

                                Key features include:
                                * **Durable Priority Queue:** Jobs are claimed by priority, then by age, and retried with backoff.
                                * **Per-Type Policies:** Method, level and minimum size are configured per document type.
                                * **Statistics:** Endpoints report space savings, per-type breakdowns and the queue state.
                                """)
                        .contact(new Contact()
                                .name("EyeLevel.ai Support")
                                .url("https://www.eyelevel.ai")));
    }
}
