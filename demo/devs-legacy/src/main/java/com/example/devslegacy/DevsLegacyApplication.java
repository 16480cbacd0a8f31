package com.example.devslegacy;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class DevsLegacyApplication {

    public static void main(String[] args) {
        SpringApplication.run(DevsLegacyApplication.class, args);
    }
}
