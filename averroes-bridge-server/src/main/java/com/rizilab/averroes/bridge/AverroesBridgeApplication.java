package com.rizilab.averroes.bridge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AverroesBridgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(AverroesBridgeApplication.class, args);
    }
}
