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

import java.sql.PreparedStatement;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Customer CRUD over plain JDBC.
 *
 * Each verb is a single-row statement. Updating or deleting an unknown id
 * touches nothing and is not an error; callers that need existence check
 * with {@link #findCustomer(long)} first.
 *
 * Deleting a customer leaves its invoices in place with no customer: the
 * schema declares the reference ON DELETE SET NULL.
 */
@Service
@Slf4j
public class CustomerService {

    private static final String SELECT_COLUMNS =
        "SELECT id, name, email, phone, address, tax_number, created_at FROM customers";

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    public CustomerService(JdbcTemplate jdbcTemplate, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.clock = clock;
    }

    /**
     * @return the identifier assigned to the new customer
     */
    @Transactional
    public long createCustomer(CustomerDraft draft) {
        validate(draft);
        KeyHolder keyHolder = new GeneratedKeyHolder();
        try {
            jdbcTemplate.update(connection -> {
                PreparedStatement ps = connection.prepareStatement(
                    "INSERT INTO customers (name, email, phone, address, tax_number, created_at) "
                        + "VALUES (?, ?, ?, ?, ?, ?)",
                    new String[] {"id"});
                ps.setString(1, draft.getName().trim());
                ps.setString(2, draft.getEmail());
                ps.setString(3, draft.getPhone());
                ps.setString(4, draft.getAddress());
                ps.setString(5, draft.getTaxNumber());
                ps.setTimestamp(6, Timestamp.valueOf(LocalDateTime.now(clock)));
                return ps;
            }, keyHolder);
        } catch (DataAccessException e) {
            throw StorageFailureException.wrap("Create customer", e);
        }
        long id = keyHolder.getKey().longValue();
        log.info("Created customer {} ({})", id, draft.getName().trim());
        return id;
    }

    /**
     * Replaces all mutable fields of a customer.
     *
     * @return number of rows changed, 0 for an unknown id
     */
    @Transactional
    public int updateCustomer(long customerId, CustomerDraft draft) {
        validate(draft);
        try {
            int rows = jdbcTemplate.update(
                "UPDATE customers SET name = ?, email = ?, phone = ?, address = ?, tax_number = ? WHERE id = ?",
                draft.getName().trim(),
                draft.getEmail(),
                draft.getPhone(),
                draft.getAddress(),
                draft.getTaxNumber(),
                customerId
            );
            if (rows == 0) {
                log.debug("Update of unknown customer {} ignored", customerId);
            }
            return rows;
        } catch (DataAccessException e) {
            throw StorageFailureException.wrap("Update customer " + customerId, e);
        }
    }

    /**
     * @return true if a row was removed
     */
    @Transactional
    public boolean deleteCustomer(long customerId) {
        try {
            int rows = jdbcTemplate.update("DELETE FROM customers WHERE id = ?", customerId);
            if (rows > 0) {
                log.info("Deleted customer {}", customerId);
            }
            return rows > 0;
        } catch (DataAccessException e) {
            throw StorageFailureException.wrap("Delete customer " + customerId, e);
        }
    }

    /**
     * @return all customers, newest identifier first
     */
    @Transactional(readOnly = true)
    public List<Customer> fetchCustomers() {
        return jdbcTemplate.query(SELECT_COLUMNS + " ORDER BY id DESC", customerRowMapper());
    }

    @Transactional(readOnly = true)
    public Optional<Customer> findCustomer(long customerId) {
        return jdbcTemplate.query(SELECT_COLUMNS + " WHERE id = ?", customerRowMapper(), customerId)
            .stream()
            .findFirst();
    }

    @Transactional(readOnly = true)
    public boolean exists(long customerId) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM customers WHERE id = ?", Integer.class, customerId);
        return count != null && count > 0;
    }

    private void validate(CustomerDraft draft) {
        if (draft == null || draft.getName() == null || draft.getName().isBlank()) {
            throw new ValidationException("Customer name is required");
        }
    }

    private RowMapper<Customer> customerRowMapper() {
        return (rs, rowNum) -> new Customer(
            rs.getLong("id"),
            rs.getString("name"),
            rs.getString("email"),
            rs.getString("phone"),
            rs.getString("address"),
            rs.getString("tax_number"),
            rs.getObject("created_at", LocalDateTime.class)
        );
    }
}
