package com.platform.prioritizer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PrioritizerApplication {

    public static void main(String[] args) {
        SpringApplication.run(PrioritizerApplication.class, args);
    }
}
