package com.consular.network;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class NetworkAnalyticsApplication {

    public static void main(String[] args) {
        SpringApplication.run(NetworkAnalyticsApplication.class, args);
    }
}
