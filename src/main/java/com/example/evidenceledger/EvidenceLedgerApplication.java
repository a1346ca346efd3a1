package com.example.evidenceledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class EvidenceLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(EvidenceLedgerApplication.class, args);
    }
}
