package com.example.cronpurge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CronPurgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(CronPurgeApplication.class, args);
    }
}
