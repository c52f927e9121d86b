package com.logsense.anomaly;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LogSenseApplication {

    public static void main(String[] args) {
        SpringApplication.run(LogSenseApplication.class, args);
    }
}
