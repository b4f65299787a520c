package com.example.bulkorder;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BulkOrderApplication {

    public static void main(String[] args) {
        SpringApplication.run(BulkOrderApplication.class, args);
    }
}
