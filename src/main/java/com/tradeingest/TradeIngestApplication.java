package com.tradeingest;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TradeIngestApplication {

    public static void main(String[] args) {
        SpringApplication.run(TradeIngestApplication.class, args);
    }
}
