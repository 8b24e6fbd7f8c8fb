package com.anxietycompanion;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class AnxietyCompanionApplication {
    public static void main(String[] args) {
        SpringApplication.run(AnxietyCompanionApplication.class, args);
    }
}
