package com.flagship.invoice_ledger.catalog;

import lombok.Value;

import java.time.LocalDateTime;

@Value
public class Customer {
    long id;
    String name;
    String email;
    String phone;
    String address;
    String taxNumber;
    LocalDateTime createdAt;
}
