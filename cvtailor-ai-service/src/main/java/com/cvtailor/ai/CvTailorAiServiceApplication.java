package com.cvtailor.ai;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class CvTailorAiServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(CvTailorAiServiceApplication.class, args);
    }

}
