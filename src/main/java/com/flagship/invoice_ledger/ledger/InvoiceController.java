package com.flagship.invoice_ledger.ledger;

import com.flagship.invoice_ledger.ledger.dto.InvoiceRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * REST endpoints for invoices.
 *
 * Stock shortfalls come back as 422 with productId, available and requested
 * in the details; a duplicate invoice number is 409.
 */
@RestController
@RequestMapping("/api/invoices")
@RequiredArgsConstructor
@Slf4j
public class InvoiceController {

    private final InvoiceLedgerService ledgerService;

    @GetMapping
    public List<InvoiceSummary> list() {
        return ledgerService.listInvoices();
    }

    @GetMapping("/next-number")
    public Map<String, String> nextNumber() {
        return Map.of("invoice_number", ledgerService.suggestInvoiceNumber());
    }

    @GetMapping("/{id}")
    public InvoiceDetail get(@PathVariable("id") long id) {
        return ledgerService.getInvoiceDetail(id);
    }

    @PostMapping
    public ResponseEntity<Map<String, Long>> create(@Valid @RequestBody InvoiceRequest request) {
        log.info("Received invoice creation request: number={}, lines={}",
            request.getInvoiceNumber(), request.getItems() != null ? request.getItems().size() : 0);
        long id = ledgerService.createInvoice(request.toHeader(), request.toItemDrafts());
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("id", id));
    }

    @PutMapping("/{id}")
    public ResponseEntity<Void> update(@PathVariable("id") long id, @Valid @RequestBody InvoiceRequest request) {
        ledgerService.updateInvoice(id, request.toHeader(), request.toItemDrafts());
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable("id") long id) {
        ledgerService.deleteInvoice(id);
        return ResponseEntity.noContent().build();
    }
}
