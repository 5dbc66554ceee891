package com.eyelevel.bulkconverter;

import com.eyelevel.bulkconverter.config.ConversionProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.core.env.Environment;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * The main entry point for the Bulk Converter Spring Boot application.
 * <p>
 * This class bootstraps the application context and enables key Spring features:
 * <ul>
 *     <li>{@link EnableConfigurationProperties}: Binds the "app.conversion" properties to
 *     {@link ConversionProperties}.</li>
 *     <li>{@link EnableScheduling}: Activates the trigger polling loop.</li>
 *     <li>{@link EnableRetry}: Enables retried uploads of job status logs.</li>
 * </ul>
 */
@Slf4j
@EnableScheduling
@SpringBootApplication
@EnableConfigurationProperties(value = ConversionProperties.class)
@EnableRetry
public class BulkConverterApplication {

    public static void main(final String[] args) {
        log.info("Starting BulkConverterApplication...");

        final ConfigurableApplicationContext context = SpringApplication.run(BulkConverterApplication.class, args);
        final Environment env = context.getEnvironment();

        log.info("------------------------------------------------------------------");
        log.info("Application '{}' is now running!", env.getProperty("spring.application.name", "BulkConverter"));
        log.info("  - Local:      http://localhost:{}", env.getProperty("server.port", "8080"));
        log.info("  - Profile(s): {}", String.join(", ", env.getActiveProfiles().length > 0
                ? env.getActiveProfiles()
                : new String[]{"default"}));
        log.info("  - Polling:    every {}", env.getProperty("app.conversion.trigger.polling-interval", "PT120S"));
        log.info("------------------------------------------------------------------");
    }
}
