package com.cellactors;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class CellActorsApplication {

    public static void main(String[] args) {
        SpringApplication.run(CellActorsApplication.class, args);
    }
}
