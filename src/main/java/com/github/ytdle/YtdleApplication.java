package com.github.ytdle;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class YtdleApplication {

    public static void main(String[] args) {
        SpringApplication.run(YtdleApplication.class, args);
    }
}
