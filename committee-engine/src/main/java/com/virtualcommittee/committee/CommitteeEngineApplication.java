package com.virtualcommittee.committee;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CommitteeEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(CommitteeEngineApplication.class, args);
    }
}
