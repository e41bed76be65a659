package com.agentscan;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AgentScanApplication {

    public static void main(String[] args) {
        SpringApplication.run(AgentScanApplication.class, args);
    }
}
