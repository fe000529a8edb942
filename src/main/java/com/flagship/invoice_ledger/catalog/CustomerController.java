package com.flagship.invoice_ledger.catalog;

import com.flagship.invoice_ledger.catalog.dto.CustomerRequest;
import com.flagship.invoice_ledger.exception.CustomerNotFoundException;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
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
 * REST endpoints for customers.
 *
 * The service treats updates of unknown ids as no-ops; over HTTP they are 404.
 */
@RestController
@RequestMapping("/api/customers")
@RequiredArgsConstructor
public class CustomerController {

    private final CustomerService customerService;

    @GetMapping
    public List<Customer> list() {
        return customerService.fetchCustomers();
    }

    @GetMapping("/{id}")
    public Customer get(@PathVariable("id") long id) {
        return customerService.findCustomer(id).orElseThrow(() -> new CustomerNotFoundException(id));
    }

    @PostMapping
    public ResponseEntity<Map<String, Long>> create(@Valid @RequestBody CustomerRequest request) {
        long id = customerService.createCustomer(request.toDraft());
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("id", id));
    }

    @PutMapping("/{id}")
    public ResponseEntity<Void> update(@PathVariable("id") long id, @Valid @RequestBody CustomerRequest request) {
        if (customerService.updateCustomer(id, request.toDraft()) == 0) {
            throw new CustomerNotFoundException(id);
        }
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable("id") long id) {
        if (!customerService.deleteCustomer(id)) {
            throw new CustomerNotFoundException(id);
        }
        return ResponseEntity.noContent().build();
    }
}
