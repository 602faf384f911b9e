package com.williamcallahan.tutormemory;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class TutorMemoryApplication {

    public static void main(String[] args) {
        SpringApplication.run(TutorMemoryApplication.class, args);
    }

}
