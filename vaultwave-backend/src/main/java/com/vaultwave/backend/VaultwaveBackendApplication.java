package com.vaultwave.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class VaultwaveBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(VaultwaveBackendApplication.class, args);
    }
}
