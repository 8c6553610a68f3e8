package com.aiops.anomaly;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync(proxyTargetClass = true)
public class LogAnomalyDetectionApplication {

    public static void main(String[] args) {
        SpringApplication.run(LogAnomalyDetectionApplication.class, args);
    }
}
