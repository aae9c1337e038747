package com.example.roomchat;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class RoomLiveChatApplication {

    public static void main(String[] args) {
        SpringApplication.run(RoomLiveChatApplication.class, args);
    }
}
