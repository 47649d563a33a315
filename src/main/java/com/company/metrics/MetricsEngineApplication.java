package com.company.metrics;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class MetricsEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(MetricsEngineApplication.class, args);
    }
}
