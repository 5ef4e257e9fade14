package com.arbitration.award;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class AwardIntegrityApplication {

    public static void main(String[] args) {
        SpringApplication.run(AwardIntegrityApplication.class, args);
    }
}
