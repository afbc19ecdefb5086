package com.example.annotate;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class AnnotateApplication {

    public static void main(String[] args) {
        SpringApplication.run(AnnotateApplication.class, args);
    }
}
