package com.demo.loadclient;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LoadClientApplication {
    public static void main(String[] args) {
        SpringApplication.run(LoadClientApplication.class, args);
    }
}
