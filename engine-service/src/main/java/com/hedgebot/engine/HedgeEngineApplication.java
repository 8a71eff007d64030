package com.hedgebot.engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class HedgeEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(HedgeEngineApplication.class, args);
    }
}
