package com.openforge.searchmate;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SearchmateApplication {

    public static void main(String[] args) {
        SpringApplication.run(SearchmateApplication.class, args);
    }
}
