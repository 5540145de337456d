package com.nutrimatch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * NutriMatch Server Application
 *
 * Diet-aware recipe search and recommendation API built with Spring Boot WebFlux.
 */
@SpringBootApplication
public class NutriMatchApplication {

    public static void main(String[] args) {
        SpringApplication.run(NutriMatchApplication.class, args);
    }

}
