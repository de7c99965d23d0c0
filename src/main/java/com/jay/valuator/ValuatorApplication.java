package com.jay.valuator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ValuatorApplication {
    public static void main(String[] args) {
        SpringApplication.run(ValuatorApplication.class, args);
    }
}
