package com.flagship.retail_banking;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class RetailBankingApplication {

    public static void main(String[] args) {
        SpringApplication.run(RetailBankingApplication.class, args);
    }
}
