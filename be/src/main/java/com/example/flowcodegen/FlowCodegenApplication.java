package com.example.flowcodegen;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FlowCodegenApplication {

    public static void main(String[] args) {
        SpringApplication.run(FlowCodegenApplication.class, args);
    }
}
