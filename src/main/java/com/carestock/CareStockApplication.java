package com.carestock;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class CareStockApplication {

    public static void main(String[] args) {
        SpringApplication.run(CareStockApplication.class, args);
    }
}
