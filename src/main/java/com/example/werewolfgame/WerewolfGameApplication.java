package com.example.werewolfgame;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class WerewolfGameApplication {

    public static void main(String[] args) {
        SpringApplication.run(WerewolfGameApplication.class, args);
    }
}
