package com.demoBank.swapPremium;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SwapPremiumApplication {

    public static void main(String[] args) {
        SpringApplication.run(SwapPremiumApplication.class, args);
    }
}
