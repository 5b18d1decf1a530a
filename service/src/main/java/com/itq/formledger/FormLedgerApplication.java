package com.itq.formledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FormLedgerApplication {
    public static void main(String[] args) {
        SpringApplication.run(FormLedgerApplication.class, args);
    }
}
