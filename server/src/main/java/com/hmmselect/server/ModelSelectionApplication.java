package com.hmmselect.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ModelSelectionApplication {

    public static void main(String[] args) {
        SpringApplication.run(ModelSelectionApplication.class, args);
    }
}
