package com.eyelevel.jobrelay.config;

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
        String appName = buildProperties.map(BuildProperties::getName).orElse("Job Relay API");

        return new OpenAPI()
                .info(new Info().title(appName)
                        .version(version)
                        .description("""
                                This API hands bulk CSV datasets to out-of-process enrichment workers through
                                a shared object store and collects their results.

                                Key features include:
                                * **Chunked Submission:** Large datasets are split into bounded chunks, each tracked on its own.
                                * **Durable Status:** Every job and batch session is recorded in the store and can be looked up later.
                                * **Blocking Waits:** Endpoints can wait for a job to reach a terminal state, with a client-side timeout.
                                * **Result Merging:** Completed chunk results are merged into one artifact, reporting how many chunks succeeded.

                                **Note:** Waiting endpoints hold the request thread for up to the configured maximum wait.
                                """)
                        .contact(new Contact()
                                .name("EyeLevel.ai Support")
                                .url("https://www.eyelevel.ai")));
    }
}
