package com.blackboard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BlackboardApplication {

    public static void main(String[] args) {
        SpringApplication.run(BlackboardApplication.class, args);
    }
}
