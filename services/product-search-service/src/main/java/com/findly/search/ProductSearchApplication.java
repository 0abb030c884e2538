package com.findly.search;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class ProductSearchApplication {
    public static void main(String[] args) {
        SpringApplication.run(ProductSearchApplication.class, args);
    }
}
