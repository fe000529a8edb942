package com.flagship.invoice_ledger.catalog;

import com.flagship.invoice_ledger.exception.StorageFailureException;
import com.flagship.invoice_ledger.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.sql.PreparedStatement;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Product CRUD over plain JDBC.
 *
 * unit_price and sale_price are always written with the same value so that
 * stores opened by older releases, which only know unit_price, show the
 * current price. Stock set here is the opening or corrected count; invoice
 * driven changes go through the ledger.
 */
@Service
@Slf4j
public class ProductService {

    static final String SELECT_COLUMNS =
        "SELECT id, name, description, unit_price, cost_price, sale_price, stock, unit, created_at FROM products";

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    public ProductService(JdbcTemplate jdbcTemplate, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.clock = clock;
    }

    /**
     * @return the identifier assigned to the new product
     */
    @Transactional
    public long createProduct(ProductDraft draft) {
        validate(draft);
        BigDecimal price = draft.effectiveSalePrice();
        KeyHolder keyHolder = new GeneratedKeyHolder();
        try {
            jdbcTemplate.update(connection -> {
                PreparedStatement ps = connection.prepareStatement(
                    "INSERT INTO products (name, description, unit_price, cost_price, sale_price, stock, unit, created_at) "
                        + "VALUES (?, ?, ?, ?, ?, ?, ?, ?)",
                    new String[] {"id"});
                ps.setString(1, draft.getName().trim());
                ps.setString(2, draft.getDescription());
                ps.setBigDecimal(3, price);
                ps.setBigDecimal(4, costOf(draft));
                ps.setBigDecimal(5, price);
                ps.setInt(6, stockOf(draft));
                ps.setString(7, draft.getUnit());
                ps.setTimestamp(8, Timestamp.valueOf(LocalDateTime.now(clock)));
                return ps;
            }, keyHolder);
        } catch (DataAccessException e) {
            throw StorageFailureException.wrap("Create product", e);
        }
        long id = keyHolder.getKey().longValue();
        log.info("Created product {} ({}) with stock {}", id, draft.getName().trim(), stockOf(draft));
        return id;
    }

    /**
     * Replaces all mutable fields of a product, stock included.
     *
     * @return number of rows changed, 0 for an unknown id
     */
    @Transactional
    public int updateProduct(long productId, ProductDraft draft) {
        validate(draft);
        BigDecimal price = draft.effectiveSalePrice();
        try {
            int rows = jdbcTemplate.update(
                "UPDATE products SET name = ?, description = ?, unit_price = ?, cost_price = ?, sale_price = ?, "
                    + "stock = ?, unit = ? WHERE id = ?",
                draft.getName().trim(),
                draft.getDescription(),
                price,
                costOf(draft),
                price,
                stockOf(draft),
                draft.getUnit(),
                productId
            );
            if (rows == 0) {
                log.debug("Update of unknown product {} ignored", productId);
            }
            return rows;
        } catch (DataAccessException e) {
            throw StorageFailureException.wrap("Update product " + productId, e);
        }
    }

    /**
     * Removes a product that no invoice line refers to.
     *
     * @return true if a row was removed
     * @throws ValidationException if invoice items still reference the product
     */
    @Transactional
    public boolean deleteProduct(long productId) {
        Integer references = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM invoice_items WHERE product_id = ?", Integer.class, productId);
        if (references != null && references > 0) {
            log.warn("Refused to delete product {} referenced by {} invoice items", productId, references);
            throw new ValidationException(
                "Product " + productId + " is referenced by " + references + " invoice items and cannot be deleted");
        }
        try {
            int rows = jdbcTemplate.update("DELETE FROM products WHERE id = ?", productId);
            if (rows > 0) {
                log.info("Deleted product {}", productId);
            }
            return rows > 0;
        } catch (DataAccessException e) {
            throw StorageFailureException.wrap("Delete product " + productId, e);
        }
    }

    /**
     * @return all products, newest identifier first
     */
    @Transactional(readOnly = true)
    public List<Product> fetchProducts() {
        return jdbcTemplate.query(SELECT_COLUMNS + " ORDER BY id DESC", productRowMapper());
    }

    @Transactional(readOnly = true)
    public Optional<Product> findProduct(long productId) {
        return jdbcTemplate.query(SELECT_COLUMNS + " WHERE id = ?", productRowMapper(), productId)
            .stream()
            .findFirst();
    }

    private void validate(ProductDraft draft) {
        if (draft == null || draft.getName() == null || draft.getName().isBlank()) {
            throw new ValidationException("Product name is required");
        }
        requireNonNegative("Unit price", draft.getUnitPrice());
        requireNonNegative("Sale price", draft.getSalePrice());
        requireNonNegative("Cost price", draft.getCostPrice());
        if (draft.getStock() != null && draft.getStock() < 0) {
            throw new ValidationException("Stock must not be negative: " + draft.getStock());
        }
    }

    private static void requireNonNegative(String field, BigDecimal value) {
        if (value != null && value.signum() < 0) {
            throw new ValidationException(field + " must not be negative: " + value.toPlainString());
        }
    }

    private static BigDecimal costOf(ProductDraft draft) {
        return draft.getCostPrice() != null ? draft.getCostPrice() : BigDecimal.ZERO;
    }

    private static int stockOf(ProductDraft draft) {
        return draft.getStock() != null ? draft.getStock() : 0;
    }

    static RowMapper<Product> productRowMapper() {
        return (rs, rowNum) -> new Product(
            rs.getLong("id"),
            rs.getString("name"),
            rs.getString("description"),
            rs.getBigDecimal("unit_price"),
            rs.getBigDecimal("cost_price"),
            rs.getBigDecimal("sale_price"),
            rs.getInt("stock"),
            rs.getString("unit"),
            rs.getObject("created_at", LocalDateTime.class)
        );
    }
}
