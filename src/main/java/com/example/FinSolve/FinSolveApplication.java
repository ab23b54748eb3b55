package com.example.FinSolve;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FinSolveApplication {

    public static void main(String[] args) {
        SpringApplication.run(FinSolveApplication.class, args);
    }
}
