package com.purchasingpower.salesgraph;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SalesGraphApplication {

    public static void main(String[] args) {
        SpringApplication.run(SalesGraphApplication.class, args);
    }
}
