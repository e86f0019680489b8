package com.siqiu.scriptmonitor.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.siqiu.scriptmonitor.notify.DeadLetterClient;
import com.siqiu.scriptmonitor.notify.SqsDeadLetterClient;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClients;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.sqs.SqsClient;

import java.net.URI;

@Configuration
public class NotificationConfig {

    // webhook targets are operator-configured, so they do not go through the script gatekeeper
    @Bean(destroyMethod = "close")
    public CloseableHttpClient webhookHttpClient(@Value("${monitor.notify.webhook-timeout-ms:10000}") int timeoutMs) {
        RequestConfig requestConfig = RequestConfig.custom()
                .setConnectTimeout(timeoutMs)
                .setConnectionRequestTimeout(timeoutMs)
                .setSocketTimeout(timeoutMs)
                .build();
        return HttpClients.custom()
                .setDefaultRequestConfig(requestConfig)
                .disableAutomaticRetries()
                .setUserAgent("script-monitor/1.0")
                .build();
    }

    @Bean
    @ConditionalOnProperty(name = "monitor.notify.dead-letter.mode", havingValue = "sqs")
    public SqsClient sqsClient(
            @Value("${monitor.sqs.endpoint}") String endpoint,
            @Value("${monitor.sqs.region}") String region
    ) {
        return SqsClient.builder()
                .endpointOverride(URI.create(endpoint))
                .region(Region.of(region))
                .credentialsProvider(StaticCredentialsProvider.create(AwsBasicCredentials.create("test", "test")))
                .build();
    }

    @Bean
    @ConditionalOnProperty(name = "monitor.notify.dead-letter.mode", havingValue = "sqs")
    public DeadLetterClient deadLetterClient(
            SqsClient sqsClient,
            @Value("${monitor.sqs.dlqName}") String dlqName,
            ObjectMapper mapper
    ) {
        return new SqsDeadLetterClient(sqsClient, dlqName, mapper);
    }
}
