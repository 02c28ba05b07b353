package com.isolend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class IsolendApplication {

    public static void main(String[] args) {
        SpringApplication.run(IsolendApplication.class, args);
    }
}
