package com.queryroute;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class QueryRouteApplication {

    public static void main(String[] args) {
        SpringApplication.run(QueryRouteApplication.class, args);
    }
}
