package com.bristol.siteintel;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class SiteIntelApplication {

    public static void main(String[] args) {
        SpringApplication.run(SiteIntelApplication.class, args);
    }
}
