package com.jcmt.hetitc;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class HetItcApplication {

    public static void main(String[] args) {
        SpringApplication.run(HetItcApplication.class, args);
    }

}
