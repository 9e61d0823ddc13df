package com.tenacy.tradepulse;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TradePulseApplication {

    public static void main(String[] args) {
        SpringApplication.run(TradePulseApplication.class, args);
    }
}
