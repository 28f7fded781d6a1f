package com.throttle;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ThrottleApplication {
    
    public static void main(String[] args) {
        SpringApplication.run(ThrottleApplication.class, args);
    }
}
