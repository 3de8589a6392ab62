package com.cred.freestyle.marketplace.config;

import io.micrometer.cloudwatch2.CloudWatchMeterRegistry;
import io.micrometer.core.instrument.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.cloudwatch.CloudWatchAsyncClient;

import java.util.HashMap;
import java.util.Map;

/**
 * Ships the payment and entitlement metrics to CloudWatch.
 * With {@code cloud.aws.cloudwatch.enabled=false} nothing here is created and
 * Spring Boot's default registry backs {@code CloudWatchMetricsService}.
 *
 * @author Marketplace Team
 */
@Configuration
@ConditionalOnProperty(name = "cloud.aws.cloudwatch.enabled", havingValue = "true", matchIfMissing = true)
public class CloudWatchConfig {

    private static final Logger logger = LoggerFactory.getLogger(CloudWatchConfig.class);

    @Value("${spring.application.name:marketplace-payments}")
    private String applicationName;

    @Value("${cloud.aws.region:us-east-1}")
    private String awsRegion;

    @Value("${cloud.aws.cloudwatch.namespace:Marketplace}")
    private String namespace;

    @Value("${cloud.aws.cloudwatch.batch-size:20}")
    private Integer batchSize;

    @Value("${cloud.aws.cloudwatch.step:PT1M}")
    private String step;

    @Bean
    public CloudWatchAsyncClient cloudWatchAsyncClient() {
        return CloudWatchAsyncClient.builder()
                .region(Region.of(awsRegion))
                .credentialsProvider(DefaultCredentialsProvider.create())
                .build();
    }

    /**
     * Registry publishing every {@code marketplace.*} meter, tagged with the application name.
     *
     * @param cloudWatchAsyncClient CloudWatch client
     * @return CloudWatch meter registry
     */
    @Bean
    public CloudWatchMeterRegistry cloudWatchMeterRegistry(CloudWatchAsyncClient cloudWatchAsyncClient) {
        Map<String, String> settings = new HashMap<>();
        settings.put("cloudwatch.namespace", namespace);
        settings.put("cloudwatch.batchSize", String.valueOf(batchSize));
        settings.put("cloudwatch.step", step);

        io.micrometer.cloudwatch2.CloudWatchConfig registryConfig = settings::get;

        CloudWatchMeterRegistry registry = new CloudWatchMeterRegistry(registryConfig, Clock.SYSTEM, cloudWatchAsyncClient);
        registry.config().commonTags("application", applicationName);

        logger.info("CloudWatch metrics enabled - namespace: {}, region: {}, step: {}", namespace, awsRegion, step);
        return registry;
    }
}
