package com.cvrfplatform.belief;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BeliefServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(BeliefServiceApplication.class, args);
    }
}
