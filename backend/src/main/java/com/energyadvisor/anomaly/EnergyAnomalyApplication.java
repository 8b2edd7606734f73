package com.energyadvisor.anomaly;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Energy Bill Anomaly Advisor
 *
 * Flags household energy bills whose consumption deviates from the household's
 * own history, from similar households and from a weather-normalized expectation.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableScheduling
public class EnergyAnomalyApplication {

    public static void main(String[] args) {
        SpringApplication.run(EnergyAnomalyApplication.class, args);
    }
}
