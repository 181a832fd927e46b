package com.agentsearch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.cache.annotation.EnableCaching;

@EnableCaching
@SpringBootApplication
public class AgentSearchApplication {

    public static void main(String[] args) {
        SpringApplication.run(AgentSearchApplication.class, args);
    }
}
