package com.kotsin.weather;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Spring Boot application hosting the ensemble forecasting and anomaly detection core.
 */
@SpringBootApplication
public class WeatherInsightApplication {

    public static void main(String[] args) {
        SpringApplication.run(WeatherInsightApplication.class, args);
    }
}
