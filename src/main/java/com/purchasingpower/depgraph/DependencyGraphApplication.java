package com.purchasingpower.depgraph;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class DependencyGraphApplication {

    public static void main(String[] args) {
        SpringApplication.run(DependencyGraphApplication.class, args);
    }
}
