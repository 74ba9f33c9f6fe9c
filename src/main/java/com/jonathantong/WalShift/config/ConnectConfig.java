package com.jonathantong.WalShift.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * HTTP client for the Kafka Connect REST API
 */
@Configuration
public class ConnectConfig {

    @Bean(name = "connectRestTemplate")
    public RestTemplate connectRestTemplate(RestTemplateBuilder builder, WalShiftProperties properties) {
        return builder
                .rootUri(properties.getConnector().getConnectUrl())
                .setConnectTimeout(Duration.ofSeconds(5))
                .setReadTimeout(Duration.ofSeconds(30))
                .build();
    }
}
