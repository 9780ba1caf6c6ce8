package com.polymarket.ctf;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class ConditionalTokensApplication {

    public static void main(String[] args) {
        SpringApplication.run(ConditionalTokensApplication.class, args);
    }

}
