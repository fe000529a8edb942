package com.flagship.invoice_ledger.catalog;

import lombok.Builder;
import lombok.Value;

/**
 * Mutable customer fields as supplied by the caller on create and update.
 */
@Value
@Builder
public class CustomerDraft {
    String name;
    String email;
    String phone;
    String address;
    String taxNumber;
}
