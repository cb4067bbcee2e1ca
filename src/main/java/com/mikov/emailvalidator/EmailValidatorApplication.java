package com.mikov.emailvalidator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class EmailValidatorApplication {

    public static void main(String[] args) {
        SpringApplication.run(EmailValidatorApplication.class, args);
    }
}
