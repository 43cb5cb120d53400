package com.example.guardianintake;

import com.example.guardianintake.config.IntakeProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(IntakeProperties.class)
public class GuardianIntakeApplication {

    public static void main(String[] args) {
        SpringApplication.run(GuardianIntakeApplication.class, args);
    }
}
