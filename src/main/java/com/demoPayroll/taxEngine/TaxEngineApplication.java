package com.demoPayroll.taxEngine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TaxEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(TaxEngineApplication.class, args);
    }
}
