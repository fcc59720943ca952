package com.nicuanalytics;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class NicuAnalyticsApplication {

    public static void main(String[] args) {
        SpringApplication.run(NicuAnalyticsApplication.class, args);
    }
}
