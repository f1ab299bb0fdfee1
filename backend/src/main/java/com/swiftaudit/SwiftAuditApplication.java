package com.swiftaudit;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SwiftAuditApplication {

    public static void main(String[] args) {
        SpringApplication.run(SwiftAuditApplication.class, args);
    }
}
