package com.flagship.footy_marketplace;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class FootyMarketplaceApplication {

    public static void main(String[] args) {
        SpringApplication.run(FootyMarketplaceApplication.class, args);
    }
}
