package com.eyelevel.jobrelay;

import com.eyelevel.jobrelay.config.JobRelayConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.core.env.Environment;

/**
 * The main entry point for the Job Relay Spring Boot application.
 * <p>
 * This class bootstraps the application context and enables key Spring features:
 * <ul>
 *     <li>{@link SpringBootApplication}: A composite annotation that enables auto-configuration,
 *     component scanning, and property support.</li>
 *     <li>{@link EnableConfigurationProperties}: Binds custom application properties (prefixed with "app.relay")
 *     to the {@link JobRelayConfig} class.</li>
 * </ul>
 */
@Slf4j
@SpringBootApplication
@EnableConfigurationProperties(value = JobRelayConfig.class)
public class JobRelayApplication {

    /**
     * Launches the application and logs key environment information upon startup.
     *
     * @param args Command-line arguments passed to the application.
     */
    public static void main(final String[] args) {
        log.info("🚀 Starting JobRelayApplication...");

        final ConfigurableApplicationContext context = SpringApplication.run(JobRelayApplication.class, args);
        final Environment env = context.getEnvironment();

        log.info("------------------------------------------------------------------");
        log.info("Application '{}' is now running!", env.getProperty("spring.application.name", "JobRelay"));
        log.info("  - Local:      http://localhost:{}", env.getProperty("server.port", "8080"));
        log.info("  - Store:      {}", env.getProperty("app.relay.store", "s3"));
        log.info("  - Profile(s): {}", String.join(", ", env.getActiveProfiles().length > 0
                ? env.getActiveProfiles()
                : new String[]{"default"}));
        log.info("------------------------------------------------------------------");
    }
}
