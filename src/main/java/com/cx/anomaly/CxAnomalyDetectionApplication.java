package com.cx.anomaly;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class CxAnomalyDetectionApplication {

    public static void main(String[] args) {
        SpringApplication.run(CxAnomalyDetectionApplication.class, args);
    }
}
