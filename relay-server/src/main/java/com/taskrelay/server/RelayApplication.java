package com.taskrelay.server;

import com.taskrelay.server.config.RelayProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.ComponentScan;

/**
 * Main application entry point for the task relay.
 */
@SpringBootApplication
@EnableConfigurationProperties(RelayProperties.class)
@ComponentScan(basePackages = {
    "com.taskrelay.server",
    "com.taskrelay.engine"
})
public class RelayApplication {

    public static void main(String[] args) {
        SpringApplication.run(RelayApplication.class, args);
    }
}
