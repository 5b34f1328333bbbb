package com.bazaar;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class BazaarApplication {
    public static void main(String[] args) {
        SpringApplication.run(BazaarApplication.class, args);
    }
}
