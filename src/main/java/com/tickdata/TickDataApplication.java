package com.tickdata;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TickDataApplication {

    public static void main(String[] args) {
        SpringApplication.run(TickDataApplication.class, args);
    }
}
