package com.github.nlayna.coldarchive;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class ColdArchiveApplication {

    public static void main(String[] args) {
        SpringApplication.run(ColdArchiveApplication.class, args);
    }
}
