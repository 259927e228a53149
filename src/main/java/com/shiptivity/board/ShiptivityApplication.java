package com.shiptivity.board;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ShiptivityApplication {

    public static void main(String[] args) {
        SpringApplication.run(ShiptivityApplication.class, args);
    }
}
