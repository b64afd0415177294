package com.eyelevel.documentanalyzer.config;

import io.swagger.v3.oas.models.OpenAPI;
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
        String appName = buildProperties.map(BuildProperties::getName).orElse("Financial Document Analyzer API");

        return new OpenAPI()
                .info(new Info().title(appName)
                        .version(version)
                        .description("""
                                Upload plain-text financial documents and read back the fields extracted from them.

                                * **Asynchronous Processing:** every upload creates a PENDING document and a background job.
                                * **Field Extraction:** vendor, invoice number, date and total are pulled out with ordered patterns.
                                * **Status Monitoring:** poll the job status, then read the document for its parsed fields.

                                **Note:** a FAILED document and a SUCCESS document with no fields look alike apart from `status`.
                                """));
    }
}
