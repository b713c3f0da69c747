package com.docchat.chatbot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DocChatApplication {

    public static void main(String[] args) {
        SpringApplication.run(DocChatApplication.class, args);
    }
}
