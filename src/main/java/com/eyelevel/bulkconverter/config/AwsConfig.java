package com.eyelevel.bulkconverter.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;
import org.springframework.util.StringUtils;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.core.retry.RetryMode;
import software.amazon.awssdk.core.retry.RetryPolicy;
import software.amazon.awssdk.http.SdkHttpClient;
import software.amazon.awssdk.http.apache.ApacheHttpClient;
import software.amazon.awssdk.regions.Region;

/**
 * Configures the pooled network client used by the object-store binding. The connection pool, the retry
 * count and the timeouts come from {@code app.conversion.transport}; the pool is shared read-only by all
 * conversion workers.
 */
@Slf4j
@Configuration
public class AwsConfig {

    @Value("${aws.region}")
    private String awsRegion;

    @Value("${aws.access-key:}")
    private String accessKey;

    @Value("${aws.secret-key:}")
    private String secretKey;

    /**
     * Determines which credentials provider to use based on the active Spring profile.
     */
    @Bean
    public AwsCredentialsProvider awsCredentialsProvider(Environment environment) {
        if (environment.acceptsProfiles(Profiles.of("local"))) {
            log.info("Local profile active. Using StaticCredentialsProvider.");
            if (!StringUtils.hasText(accessKey) || !StringUtils.hasText(secretKey)) {
                throw new IllegalArgumentException(
                        "aws.access-key and aws.secret-key must be set for the 'local' profile.");
            }
            return StaticCredentialsProvider.create(AwsBasicCredentials.create(accessKey, secretKey));
        } else {
            log.info("Non-local profile active. Using DefaultCredentialsProvider (for IAM role).");
            return DefaultCredentialsProvider.create();
        }
    }

    @Bean
    public Region awsRegion() {
        return Region.of(awsRegion);
    }

    /**
     * Shared override configuration with an adaptive retry policy bounded by the transport's max-retries
     * and a per-attempt timeout.
     */
    @Bean
    public ClientOverrideConfiguration clientOverrideConfiguration(ConversionProperties properties) {
        final ConversionProperties.Transport transport = properties.transport();
        RetryPolicy adaptiveRetryPolicy = RetryPolicy.forRetryMode(RetryMode.ADAPTIVE).toBuilder()
                                                     .numRetries(transport.maxRetries()).build();

        return ClientOverrideConfiguration.builder()
                                          .retryPolicy(adaptiveRetryPolicy)
                                          .apiCallAttemptTimeout(transport.timeout())
                                          .build();
    }

    /**
     * The pooled HTTP client. Clients built on top of it do not own it, so it is closed with the context.
     */
    @Bean(destroyMethod = "close")
    public SdkHttpClient pooledHttpClient(ConversionProperties properties) {
        final ConversionProperties.Transport transport = properties.transport();
        log.info("Configuring pooled HTTP client: maxConnections={}, timeout={}, maxRetries={}",
                 transport.poolSize(), transport.timeout(), transport.maxRetries());
        return ApacheHttpClient.builder()
                               .maxConnections(transport.poolSize())
                               .connectionTimeout(transport.timeout())
                               .socketTimeout(transport.timeout())
                               .build();
    }
}
