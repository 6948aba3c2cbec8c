package com.library.lending;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LibraryLendingApplication {

    public static void main(String[] args) {
        SpringApplication.run(LibraryLendingApplication.class, args);
    }
}
