package com.dirgen.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DirgenApplication {

    public static void main(String[] args) {
        SpringApplication.run(DirgenApplication.class, args);
    }
}
