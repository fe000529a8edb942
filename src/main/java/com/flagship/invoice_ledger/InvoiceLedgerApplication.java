package com.flagship.invoice_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class InvoiceLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(InvoiceLedgerApplication.class, args);
    }
}
