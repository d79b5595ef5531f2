package com.cycleindicators.engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class IndicatorEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(IndicatorEngineApplication.class, args);
    }
}
