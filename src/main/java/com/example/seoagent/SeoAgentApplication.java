package com.example.seoagent;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class SeoAgentApplication {

    public static void main(String[] args) {
        SpringApplication.run(SeoAgentApplication.class, args);
    }
}
