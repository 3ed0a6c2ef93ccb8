package com.poc.excelingest;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ExcelIngestApplication {

    public static void main(String[] args) {
        SpringApplication.run(ExcelIngestApplication.class, args);
    }
}
