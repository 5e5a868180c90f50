package com.github.dimitryivaniuta.querycache;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class QueryCacheApplication {

    public static void main(String[] args) {
        SpringApplication.run(QueryCacheApplication.class, args);
    }
}
