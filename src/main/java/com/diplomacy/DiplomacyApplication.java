package com.diplomacy;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DiplomacyApplication {

    public static void main(String[] args) {
        SpringApplication.run(DiplomacyApplication.class, args);
    }
}
