package com.openfashion.crowdfundingservice;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.core.Ordered;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@ConfigurationPropertiesScan
// Retries must wrap the transaction so each attempt starts a fresh one
@EnableRetry(order = Ordered.LOWEST_PRECEDENCE - 1)
@EnableScheduling
public class CrowdfundingServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(CrowdfundingServiceApplication.class, args);
    }

}
