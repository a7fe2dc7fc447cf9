package com.example.routereport;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RouteReportApplication {

    public static void main(String[] args) {
        SpringApplication.run(RouteReportApplication.class, args);
    }
}
