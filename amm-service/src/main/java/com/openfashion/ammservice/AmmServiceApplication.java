package com.openfashion.ammservice;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class AmmServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(AmmServiceApplication.class, args);
    }

}
