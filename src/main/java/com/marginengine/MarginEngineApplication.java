package com.marginengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MarginEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(MarginEngineApplication.class, args);
    }
}
