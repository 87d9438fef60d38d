package com.phillippitts.erasemark.config;

import com.phillippitts.erasemark.config.inpaint.CloudConfig;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * HTTP client wiring for the remote inpainting service.
 */
@Configuration
public class CloudClientConfig {

    @Bean
    public RestTemplate cloudRestTemplate(RestTemplateBuilder builder, CloudConfig cloudConfig) {
        return builder
                .setConnectTimeout(Duration.ofMillis(cloudConfig.connectTimeoutMs()))
                .setReadTimeout(Duration.ofMillis(cloudConfig.readTimeoutMs()))
                .build();
    }
}
