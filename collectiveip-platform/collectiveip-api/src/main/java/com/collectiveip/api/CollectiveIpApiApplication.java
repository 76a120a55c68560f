package com.collectiveip.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Collective IP Platform API Application
 *
 * Shared ownership, revenue pooling, licensing and governance of intellectual-property assets.
 */
@SpringBootApplication(scanBasePackages = "com.collectiveip")
public class CollectiveIpApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(CollectiveIpApiApplication.class, args);
    }
}
