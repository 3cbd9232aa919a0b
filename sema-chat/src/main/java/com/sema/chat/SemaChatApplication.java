package com.sema.chat;

import com.sema.chat.config.ChatProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties(ChatProperties.class)
public class SemaChatApplication {

    public static void main(String[] args) {
        SpringApplication.run(SemaChatApplication.class, args);
    }
}
