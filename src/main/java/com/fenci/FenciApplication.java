package com.fenci;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FenciApplication {

    public static void main(String[] args) {
        SpringApplication.run(FenciApplication.class, args);
    }
}
