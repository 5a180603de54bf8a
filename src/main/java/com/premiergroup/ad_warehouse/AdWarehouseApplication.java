package com.premiergroup.ad_warehouse;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AdWarehouseApplication {

    public static void main(String[] args) {
        SpringApplication.run(AdWarehouseApplication.class, args);
    }
}
