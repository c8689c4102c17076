package com.example.auditcore;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class AuditCoreApplication {

    public static void main(String[] args) {
        SpringApplication.run(AuditCoreApplication.class, args);
    }
}
