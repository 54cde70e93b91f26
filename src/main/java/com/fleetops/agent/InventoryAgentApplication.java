package com.fleetops.agent;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class InventoryAgentApplication {
    public static void main(String[] args) {
        SpringApplication.run(InventoryAgentApplication.class, args);
    }
}
