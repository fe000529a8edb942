package com.flagship.invoice_ledger.ledger;

import com.flagship.invoice_ledger.exception.ProductNotFoundException;
import com.flagship.invoice_ledger.exception.StockInsufficientException;
import com.flagship.invoice_ledger.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Stock debits and credits driven by invoice lines.
 *
 * Every method must run inside the caller's transaction; this class opens
 * none of its own. Debits are guarded in SQL so a product's stock can never
 * be written below zero even if the pre-flight check was bypassed.
 */
@Component
@Slf4j
class StockLedger {

    private final JdbcTemplate jdbcTemplate;

    StockLedger(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Sums quantities per product over the stocked lines, keeping first-seen order.
     */
    static Map<Long, Integer> requestedPerProduct(List<InvoiceItemDraft> items) {
        Map<Long, BigDecimal> sums = new LinkedHashMap<>();
        for (InvoiceItemDraft item : items) {
            if (item.isStocked()) {
                sums.merge(item.getProductId(), item.quantityOrZero(), BigDecimal::add);
            }
        }
        Map<Long, Integer> requested = new LinkedHashMap<>();
        sums.forEach((productId, quantity) -> requested.put(productId, toCount(productId, quantity)));
        return requested;
    }

    /**
     * Quantities currently held by an invoice's stocked lines.
     */
    Map<Long, Integer> heldBy(long invoiceId) {
        Map<Long, Integer> held = new LinkedHashMap<>();
        jdbcTemplate.query(
            "SELECT product_id, SUM(quantity) AS qty FROM invoice_items "
                + "WHERE invoice_id = ? AND product_id IS NOT NULL GROUP BY product_id ORDER BY MIN(id)",
            rs -> {
                long productId = rs.getLong("product_id");
                BigDecimal quantity = rs.getBigDecimal("qty");
                held.put(productId, heldCount(invoiceId, productId, quantity));
            },
            invoiceId
        );
        return held;
    }

    /**
     * Checks every requested quantity against current stock.
     *
     * @throws ProductNotFoundException if a product does not exist
     * @throws StockInsufficientException naming the first product that falls short
     */
    void requireAvailable(Map<Long, Integer> requested) {
        requested.forEach((productId, quantity) -> {
            ProductStock current = currentStock(productId);
            if (current.stock < quantity) {
                throw new StockInsufficientException(
                    productId, current.name, current.stock, BigDecimal.valueOf(quantity));
            }
        });
    }

    void debit(long productId, int quantity) {
        if (quantity == 0) {
            return;
        }
        int rows = jdbcTemplate.update(
            "UPDATE products SET stock = stock - ? WHERE id = ? AND stock >= ?",
            quantity, productId, quantity);
        if (rows == 0) {
            ProductStock current = currentStock(productId);
            throw new StockInsufficientException(
                productId, current.name, current.stock, BigDecimal.valueOf(quantity));
        }
        log.debug("Debited {} from product {}", quantity, productId);
    }

    void credit(long productId, int quantity) {
        if (quantity == 0) {
            return;
        }
        int rows = jdbcTemplate.update(
            "UPDATE products SET stock = stock + ? WHERE id = ?", quantity, productId);
        if (rows == 0) {
            throw new ProductNotFoundException(productId);
        }
        log.debug("Credited {} to product {}", quantity, productId);
    }

    void debitAll(Map<Long, Integer> quantities) {
        quantities.forEach(this::debit);
    }

    void creditAll(Map<Long, Integer> quantities) {
        quantities.forEach(this::credit);
    }

    private ProductStock currentStock(long productId) {
        return jdbcTemplate.query(
                "SELECT name, stock FROM products WHERE id = ?",
                (rs, rowNum) -> new ProductStock(rs.getString("name"), rs.getInt("stock")),
                productId)
            .stream()
            .findFirst()
            .orElseThrow(() -> new ProductNotFoundException(productId));
    }

    private static int toCount(long productId, BigDecimal quantity) {
        try {
            return quantity.stripTrailingZeros().intValueExact();
        } catch (ArithmeticException e) {
            throw new ValidationException(
                "Quantity for product " + productId + " must be a whole number within range: "
                    + quantity.stripTrailingZeros().toPlainString());
        }
    }

    // Lines written before whole-number quantities were enforced may hold fractions.
    private static int heldCount(long invoiceId, long productId, BigDecimal quantity) {
        BigDecimal rounded = quantity.setScale(0, RoundingMode.HALF_UP);
        if (rounded.compareTo(quantity) != 0) {
            log.warn("Invoice {} holds fractional quantity {} of product {}; restoring {}",
                invoiceId, quantity.toPlainString(), productId, rounded.toPlainString());
        }
        return rounded.intValueExact();
    }

    private static final class ProductStock {
        private final String name;
        private final int stock;

        private ProductStock(String name, int stock) {
            this.name = name;
            this.stock = stock;
        }
    }
}
