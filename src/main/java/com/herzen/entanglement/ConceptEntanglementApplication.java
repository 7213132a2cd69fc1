package com.herzen.entanglement;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
public class ConceptEntanglementApplication {
    public static void main(String[] args) {
        SpringApplication.run(ConceptEntanglementApplication.class, args);
    }
}
