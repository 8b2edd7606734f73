package com.energyadvisor.anomaly.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;

/**
 * Shared infrastructure for the detection engine.
 */
@Configuration
public class DetectionConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RestTemplate weatherRestTemplate(AnomalyDetectionProperties properties) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) properties.weather().connectTimeout().toMillis());
        requestFactory.setReadTimeout((int) properties.weather().readTimeout().toMillis());
        return new RestTemplate(requestFactory);
    }

    /**
     * Worker pool for batch detection.
     */
    @Bean
    public ThreadPoolTaskExecutor detectionExecutor(AnomalyDetectionProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.batch().parallelism());
        executor.setMaxPoolSize(properties.batch().parallelism());
        executor.setThreadNamePrefix("detection-");
        return executor;
    }
}
