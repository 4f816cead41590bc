package com.cosign;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CosignApplication {

    public static void main(String[] args) {
        SpringApplication.run(CosignApplication.class, args);
    }
}
