package com.herzen.maxviews;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class MaxViewsApplication {
    public static void main(String[] args) {
        SpringApplication.run(MaxViewsApplication.class, args);
    }
}
