package com.streetpano;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class StreetPanoApplication {

    public static void main(String[] args) {
        SpringApplication.run(StreetPanoApplication.class, args);
    }
}
