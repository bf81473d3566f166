package com.platform.driftengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DriftEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(DriftEngineApplication.class, args);
    }
}
