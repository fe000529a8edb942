package com.flagship.invoice_ledger.ledger;

import com.flagship.invoice_ledger.exception.CustomerNotFoundException;
import com.flagship.invoice_ledger.exception.InvoiceNotFoundException;
import com.flagship.invoice_ledger.exception.LedgerException;
import com.flagship.invoice_ledger.exception.NotFoundException;
import com.flagship.invoice_ledger.exception.StockInsufficientException;
import com.flagship.invoice_ledger.exception.StorageFailureException;
import com.flagship.invoice_ledger.exception.ValidationException;
import com.flagship.invoice_ledger.observability.LedgerMetrics;
import com.flagship.invoice_ledger.settings.Settings;
import com.flagship.invoice_ledger.settings.SettingsService;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.sql.Date;
import java.sql.PreparedStatement;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Creates, edits and deletes invoices while keeping product stock consistent.
 *
 * This service enforces the core invariants:
 * 1. A product's stock is never debited below zero; a verb that would do so is rejected in full
 * 2. Deleting an invoice credits back every stocked line
 * 3. An edit credits the old lines, validates the new lines against the replenished stock,
 *    then debits them, all as one unit
 * 4. The item set of an invoice is always the set last written
 *
 * Each verb runs in exactly one {@link TransactionTemplate} scope. Any failure
 * inside the scope rolls it back before the error reaches the caller, so a
 * rejected verb leaves invoices, items and stock exactly as they were.
 */
@Service
@Slf4j
public class InvoiceLedgerService {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private static final String SELECT_INVOICE =
        "SELECT id, invoice_number, customer_id, invoice_date, due_date, total_amount, status, created_at "
            + "FROM invoices";

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final StockLedger stockLedger;
    private final SettingsService settingsService;
    private final InvoiceNumberGenerator numberGenerator;
    private final LedgerMetrics metrics;
    private final Clock clock;

    public InvoiceLedgerService(
            JdbcTemplate jdbcTemplate,
            PlatformTransactionManager transactionManager,
            StockLedger stockLedger,
            SettingsService settingsService,
            InvoiceNumberGenerator numberGenerator,
            LedgerMetrics metrics,
            Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.stockLedger = stockLedger;
        this.settingsService = settingsService;
        this.numberGenerator = numberGenerator;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Writes a new invoice with its lines and debits stock for every stocked line.
     *
     * @return the identifier of the new invoice
     * @throws ValidationException if the header or a line is invalid, or stock is insufficient
     * @throws NotFoundException if the customer or a product does not exist
     * @throws StorageFailureException if the store refuses a write, e.g. a duplicate invoice number
     */
    public long createInvoice(InvoiceHeader header, List<InvoiceItemDraft> items) {
        return inLedgerScope("create", header, null, () -> {
            List<InvoiceItemDraft> lines = validate(header, items);
            Map<Long, Integer> requested = StockLedger.requestedPerProduct(lines);

            Long invoiceId = transactionTemplate.execute(status -> {
                requireCustomer(header.getCustomerId());
                stockLedger.requireAvailable(requested);
                long id = insertHeader(header);
                MDC.put("invoiceId", String.valueOf(id));
                insertItems(id, lines);
                stockLedger.debitAll(requested);
                return id;
            });

            log.info("Created invoice {} ({}) with {} lines", invoiceId, header.getInvoiceNumber().trim(), lines.size());
            return invoiceId;
        });
    }

    /**
     * Replaces an invoice's header and complete item set.
     *
     * Stock held by the current lines is credited back before the new lines
     * are checked, so an edit may reuse the quantity the invoice already held.
     *
     * @throws InvoiceNotFoundException if the invoice does not exist
     */
    public void updateInvoice(long invoiceId, InvoiceHeader header, List<InvoiceItemDraft> items) {
        inLedgerScope("update", header, invoiceId, () -> {
            List<InvoiceItemDraft> lines = validate(header, items);
            Map<Long, Integer> requested = StockLedger.requestedPerProduct(lines);

            transactionTemplate.executeWithoutResult(status -> {
                requireInvoice(invoiceId);
                requireCustomer(header.getCustomerId());
                Map<Long, Integer> held = stockLedger.heldBy(invoiceId);
                stockLedger.creditAll(held);
                stockLedger.requireAvailable(requested);
                updateHeader(invoiceId, header);
                jdbcTemplate.update("DELETE FROM invoice_items WHERE invoice_id = ?", invoiceId);
                insertItems(invoiceId, lines);
                stockLedger.debitAll(requested);
            });

            log.info("Updated invoice {} with {} lines", invoiceId, lines.size());
            return null;
        });
    }

    /**
     * Deletes an invoice and its lines, crediting back every stocked line.
     *
     * @throws InvoiceNotFoundException if the invoice does not exist
     */
    public void deleteInvoice(long invoiceId) {
        inLedgerScope("delete", null, invoiceId, () -> {
            transactionTemplate.executeWithoutResult(status -> {
                requireInvoice(invoiceId);
                stockLedger.creditAll(stockLedger.heldBy(invoiceId));
                jdbcTemplate.update("DELETE FROM invoice_items WHERE invoice_id = ?", invoiceId);
                jdbcTemplate.update("DELETE FROM invoices WHERE id = ?", invoiceId);
            });

            log.info("Deleted invoice {}", invoiceId);
            return null;
        });
    }

    /**
     * @return all invoices, newest first, with customer names resolved
     */
    public List<InvoiceSummary> listInvoices() {
        return jdbcTemplate.query(
            "SELECT i.id, i.invoice_number, i.customer_id, c.name AS customer_name, i.invoice_date, "
                + "i.due_date, i.total_amount, i.status "
                + "FROM invoices i LEFT JOIN customers c ON c.id = i.customer_id "
                + "ORDER BY i.id DESC",
            (rs, rowNum) -> new InvoiceSummary(
                rs.getLong("id"),
                rs.getString("invoice_number"),
                nullableLong(rs.getObject("customer_id")),
                rs.getString("customer_name"),
                rs.getObject("invoice_date", LocalDate.class),
                rs.getObject("due_date", LocalDate.class),
                rs.getBigDecimal("total_amount"),
                rs.getString("status")
            )
        );
    }

    public Optional<Invoice> findInvoice(long invoiceId) {
        return jdbcTemplate.query(SELECT_INVOICE + " WHERE id = ?", invoiceRowMapper(), invoiceId)
            .stream()
            .findFirst();
    }

    /**
     * @return the invoice's lines in insertion order
     */
    public List<InvoiceItem> findItems(long invoiceId) {
        return jdbcTemplate.query(
            "SELECT id, invoice_id, product_id, description, quantity, unit_price, discount, line_total "
                + "FROM invoice_items WHERE invoice_id = ? ORDER BY id",
            (rs, rowNum) -> new InvoiceItem(
                rs.getLong("id"),
                rs.getLong("invoice_id"),
                nullableLong(rs.getObject("product_id")),
                rs.getString("description"),
                rs.getBigDecimal("quantity"),
                rs.getBigDecimal("unit_price"),
                rs.getBigDecimal("discount"),
                rs.getBigDecimal("line_total")
            ),
            invoiceId
        );
    }

    /**
     * Full read for printing and export.
     *
     * @throws InvoiceNotFoundException if the invoice does not exist
     */
    public InvoiceDetail getInvoiceDetail(long invoiceId) {
        Invoice invoice = findInvoice(invoiceId).orElseThrow(() -> new InvoiceNotFoundException(invoiceId));

        InvoiceDetail.InvoiceDetailBuilder detail = InvoiceDetail.builder().invoice(invoice);
        if (invoice.getCustomerId() != null) {
            jdbcTemplate.query(
                "SELECT name, email, phone, address, tax_number FROM customers WHERE id = ?",
                rs -> {
                    detail.customerName(rs.getString("name"))
                        .customerEmail(rs.getString("email"))
                        .customerPhone(rs.getString("phone"))
                        .customerAddress(rs.getString("address"))
                        .customerTaxNumber(rs.getString("tax_number"));
                },
                invoice.getCustomerId()
            );
        }

        List<InvoiceDetail.Line> lines = jdbcTemplate.query(
            "SELECT ii.id, ii.product_id, p.name AS product_name, ii.description, ii.quantity, "
                + "ii.unit_price, ii.discount, ii.line_total "
                + "FROM invoice_items ii LEFT JOIN products p ON p.id = ii.product_id "
                + "WHERE ii.invoice_id = ? ORDER BY ii.id",
            (rs, rowNum) -> new InvoiceDetail.Line(
                rs.getLong("id"),
                nullableLong(rs.getObject("product_id")),
                rs.getString("product_name"),
                rs.getString("description"),
                rs.getBigDecimal("quantity"),
                rs.getBigDecimal("unit_price"),
                rs.getBigDecimal("discount"),
                rs.getBigDecimal("line_total")
            ),
            invoiceId
        );
        return detail.items(lines).build();
    }

    public String suggestInvoiceNumber() {
        return numberGenerator.next();
    }

    private <T> T inLedgerScope(String operation, InvoiceHeader header, Long invoiceId, Supplier<T> body) {
        if (header != null && header.getInvoiceNumber() != null) {
            MDC.put("invoiceNumber", header.getInvoiceNumber().trim());
        }
        if (invoiceId != null) {
            MDC.put("invoiceId", String.valueOf(invoiceId));
        }
        try {
            T result = metrics.timeOperation(operation, body);
            metrics.recordOperation(operation, LedgerMetrics.OUTCOME_SUCCESS);
            return result;
        } catch (StockInsufficientException e) {
            metrics.incrementStockRejections();
            metrics.recordOperation(operation, LedgerMetrics.OUTCOME_REJECTED);
            log.warn("Invoice {} rejected: {}", operation, e.getMessage());
            throw e;
        } catch (NotFoundException e) {
            metrics.recordOperation(operation, LedgerMetrics.OUTCOME_NOT_FOUND);
            log.warn("Invoice {} rejected: {}", operation, e.getMessage());
            throw e;
        } catch (ValidationException e) {
            metrics.recordOperation(operation, LedgerMetrics.OUTCOME_REJECTED);
            log.warn("Invoice {} rejected: {}", operation, e.getMessage());
            throw e;
        } catch (DataAccessException e) {
            metrics.recordOperation(operation, LedgerMetrics.OUTCOME_FAILED);
            StorageFailureException failure = StorageFailureException.wrap("Invoice " + operation, e);
            log.error("Invoice {} failed and was rolled back: {}", operation, failure.getMessage());
            throw failure;
        } catch (LedgerException e) {
            metrics.recordOperation(operation, LedgerMetrics.OUTCOME_FAILED);
            throw e;
        } finally {
            MDC.remove("invoiceNumber");
            MDC.remove("invoiceId");
        }
    }

    private List<InvoiceItemDraft> validate(InvoiceHeader header, List<InvoiceItemDraft> items) {
        if (header == null) {
            throw new ValidationException("Invoice header is required");
        }
        if (header.getInvoiceNumber() == null || header.getInvoiceNumber().isBlank()) {
            throw new ValidationException("Invoice number is required");
        }
        requireNonNegative("Invoice total", header.getTotalAmount());

        if (items == null || items.isEmpty()) {
            throw new ValidationException("Invoice needs at least one item");
        }

        List<InvoiceItemDraft> lines = items;
        Settings settings = settingsService.getSettings();
        for (int i = 0; i < lines.size(); i++) {
            validateLine(i + 1, lines.get(i), settings);
        }
        return lines;
    }

    private void validateLine(int lineNumber, InvoiceItemDraft item, Settings settings) {
        if (item == null) {
            throw new ValidationException("Line " + lineNumber + " is empty");
        }
        if (item.getQuantity() == null) {
            throw new ValidationException("Line " + lineNumber + ": quantity is required");
        }
        requireNonNegative("Line " + lineNumber + " quantity", item.getQuantity());
        requireNonNegative("Line " + lineNumber + " unit price", item.getUnitPrice());
        requireNonNegative("Line " + lineNumber + " total", item.getLineTotal());

        BigDecimal discount = item.discountOrZero();
        if (discount.signum() < 0 || discount.compareTo(HUNDRED) > 0) {
            throw new ValidationException(
                "Line " + lineNumber + ": discount must be between 0 and 100, was " + discount.toPlainString());
        }
        if (settings.hasDiscountCap() && discount.compareTo(settings.getMaxDiscountPercent()) > 0) {
            throw new ValidationException(String.format("Line %d: discount %s exceeds the maximum of %s",
                lineNumber, discount.toPlainString(), settings.getMaxDiscountPercent().toPlainString()));
        }

        // Stock is a whole count; fractions are only allowed on ad-hoc lines.
        if (item.isStocked() && item.getQuantity().stripTrailingZeros().scale() > 0) {
            throw new ValidationException(String.format(
                "Line %d: quantity %s for product %d must be a whole number",
                lineNumber, item.getQuantity().stripTrailingZeros().toPlainString(), item.getProductId()));
        }
    }

    private static void requireNonNegative(String field, BigDecimal value) {
        if (value != null && value.signum() < 0) {
            throw new ValidationException(field + " must not be negative: " + value.toPlainString());
        }
    }

    private void requireInvoice(long invoiceId) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM invoices WHERE id = ?", Integer.class, invoiceId);
        if (count == null || count == 0) {
            throw new InvoiceNotFoundException(invoiceId);
        }
    }

    private void requireCustomer(Long customerId) {
        if (customerId == null) {
            return;
        }
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM customers WHERE id = ?", Integer.class, customerId);
        if (count == null || count == 0) {
            throw new CustomerNotFoundException(customerId);
        }
    }

    private long insertHeader(InvoiceHeader header) {
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbcTemplate.update(connection -> {
            PreparedStatement ps = connection.prepareStatement(
                "INSERT INTO invoices (invoice_number, customer_id, invoice_date, due_date, total_amount, status, created_at) "
                    + "VALUES (?, ?, ?, ?, ?, ?, ?)",
                new String[] {"id"});
            ps.setString(1, header.getInvoiceNumber().trim());
            ps.setObject(2, header.getCustomerId());
            ps.setDate(3, toSqlDate(header.getInvoiceDate()));
            ps.setDate(4, toSqlDate(header.getDueDate()));
            ps.setBigDecimal(5, totalOf(header));
            ps.setString(6, statusOf(header));
            ps.setTimestamp(7, Timestamp.valueOf(LocalDateTime.now(clock)));
            return ps;
        }, keyHolder);
        return keyHolder.getKey().longValue();
    }

    private void updateHeader(long invoiceId, InvoiceHeader header) {
        jdbcTemplate.update(
            "UPDATE invoices SET invoice_number = ?, customer_id = ?, invoice_date = ?, due_date = ?, "
                + "total_amount = ?, status = ? WHERE id = ?",
            header.getInvoiceNumber().trim(),
            header.getCustomerId(),
            toSqlDate(header.getInvoiceDate()),
            toSqlDate(header.getDueDate()),
            totalOf(header),
            statusOf(header),
            invoiceId
        );
    }

    private void insertItems(long invoiceId, List<InvoiceItemDraft> lines) {
        for (InvoiceItemDraft item : lines) {
            jdbcTemplate.update(
                "INSERT INTO invoice_items (invoice_id, product_id, description, quantity, unit_price, discount, line_total) "
                    + "VALUES (?, ?, ?, ?, ?, ?, ?)",
                invoiceId,
                item.getProductId(),
                item.getDescription(),
                item.quantityOrZero(),
                item.unitPriceOrZero(),
                item.discountOrZero(),
                item.effectiveLineTotal()
            );
        }
    }

    private static BigDecimal totalOf(InvoiceHeader header) {
        return header.getTotalAmount() != null ? header.getTotalAmount() : BigDecimal.ZERO;
    }

    private static String statusOf(InvoiceHeader header) {
        String status = header.getStatus();
        return status == null || status.isBlank() ? InvoiceHeader.DEFAULT_STATUS : status.trim();
    }

    private static Date toSqlDate(LocalDate date) {
        return date != null ? Date.valueOf(date) : null;
    }

    private static Long nullableLong(Object value) {
        return value != null ? ((Number) value).longValue() : null;
    }

    private RowMapper<Invoice> invoiceRowMapper() {
        return (rs, rowNum) -> new Invoice(
            rs.getLong("id"),
            rs.getString("invoice_number"),
            nullableLong(rs.getObject("customer_id")),
            rs.getObject("invoice_date", LocalDate.class),
            rs.getObject("due_date", LocalDate.class),
            rs.getBigDecimal("total_amount"),
            rs.getString("status"),
            rs.getObject("created_at", LocalDateTime.class)
        );
    }
}
