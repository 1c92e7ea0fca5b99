package com.polybot.oms;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class OmsServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(OmsServiceApplication.class, args);
    }
}
