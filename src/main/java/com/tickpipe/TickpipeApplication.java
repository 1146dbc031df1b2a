package com.tickpipe;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class TickpipeApplication {

    public static void main(String[] args) {
        SpringApplication.run(TickpipeApplication.class, args);
    }
}
