package com.bko.stravacache;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class StravaCacheApplication {
    public static void main(String[] args) {
        SpringApplication.run(StravaCacheApplication.class, args);
    }
}
