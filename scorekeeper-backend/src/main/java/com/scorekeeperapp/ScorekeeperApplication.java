package com.scorekeeperapp;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ScorekeeperApplication {

    public static void main(String[] args) {
        SpringApplication.run(ScorekeeperApplication.class, args);
    }
}
