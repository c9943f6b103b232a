package com.arbtrader;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableAsync
@EnableScheduling
public class ArbtraderApplication {

    public static void main(String[] args) {
        SpringApplication.run(ArbtraderApplication.class, args);
    }
}
