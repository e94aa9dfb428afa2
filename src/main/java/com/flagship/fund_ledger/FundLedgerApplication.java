package com.flagship.fund_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class FundLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(FundLedgerApplication.class, args);
    }
}
