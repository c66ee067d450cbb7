package com.example.cleanersched;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CleanerScheduleApplication {

    public static void main(String[] args) {
        SpringApplication.run(CleanerScheduleApplication.class, args);
    }
}
