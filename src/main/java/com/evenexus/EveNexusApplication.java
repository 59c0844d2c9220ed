package com.evenexus;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class EveNexusApplication {

    public static void main(String[] args) {
        SpringApplication.run(EveNexusApplication.class, args);
    }
}
