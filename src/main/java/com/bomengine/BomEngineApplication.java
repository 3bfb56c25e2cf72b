package com.bomengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BomEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(BomEngineApplication.class, args);
    }
}
