package com.calai.dietworkout;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class DietWorkoutApplication {

    public static void main(String[] args) {
        SpringApplication.run(DietWorkoutApplication.class, args);
    }
}
