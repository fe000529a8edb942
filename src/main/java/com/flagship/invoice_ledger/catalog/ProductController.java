package com.flagship.invoice_ledger.catalog;

import com.flagship.invoice_ledger.catalog.dto.ProductRequest;
import com.flagship.invoice_ledger.exception.ProductNotFoundException;
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
 * REST endpoints for products.
 */
@RestController
@RequestMapping("/api/products")
@RequiredArgsConstructor
public class ProductController {

    private final ProductService productService;

    @GetMapping
    public List<Product> list() {
        return productService.fetchProducts();
    }

    @GetMapping("/{id}")
    public Product get(@PathVariable("id") long id) {
        return productService.findProduct(id).orElseThrow(() -> new ProductNotFoundException(id));
    }

    @PostMapping
    public ResponseEntity<Map<String, Long>> create(@Valid @RequestBody ProductRequest request) {
        long id = productService.createProduct(request.toDraft());
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("id", id));
    }

    @PutMapping("/{id}")
    public ResponseEntity<Void> update(@PathVariable("id") long id, @Valid @RequestBody ProductRequest request) {
        if (productService.updateProduct(id, request.toDraft()) == 0) {
            throw new ProductNotFoundException(id);
        }
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable("id") long id) {
        if (!productService.deleteProduct(id)) {
            throw new ProductNotFoundException(id);
        }
        return ResponseEntity.noContent().build();
    }
}
