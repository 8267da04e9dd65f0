package com.demo.rent;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ZkRentApplication {

    public static void main(String[] args) {
        SpringApplication.run(ZkRentApplication.class, args);
    }
}
