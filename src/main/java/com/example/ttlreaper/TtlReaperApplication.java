package com.example.ttlreaper;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TtlReaperApplication {

    public static void main(String[] args) {
        SpringApplication.run(TtlReaperApplication.class, args);
    }
}
