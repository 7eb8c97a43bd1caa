package com.leasedesk.showing;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Showing Service Application
 * Resolves the leasing agent for a property and lists the agent's open showing times.
 */
@SpringBootApplication
public class ShowingServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(ShowingServiceApplication.class, args);
    }
}
