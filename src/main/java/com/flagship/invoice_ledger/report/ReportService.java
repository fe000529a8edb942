package com.flagship.invoice_ledger.report;

import com.flagship.invoice_ledger.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.sql.Date;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Read-only aggregates over invoices and their lines.
 */
@Service
@Slf4j
public class ReportService {

    static final String UNKNOWN_STATUS = "Unknown";

    private static final String STATUS_LABEL =
        "COALESCE(NULLIF(TRIM(status), ''), '" + UNKNOWN_STATUS + "')";

    private final JdbcTemplate jdbcTemplate;

    public ReportService(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Transactional(readOnly = true)
    public TotalsSummary totals() {
        Long customers = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM customers", Long.class);
        Long invoices = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM invoices", Long.class);
        BigDecimal revenue = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(total_amount), 0) FROM invoices", BigDecimal.class);
        return new TotalsSummary(
            customers != null ? customers : 0L,
            invoices != null ? invoices : 0L,
            revenue != null ? revenue : BigDecimal.ZERO,
            statusTotals()
        );
    }

    /**
     * Invoice totals per status, largest amount first. A missing status counts as "Unknown".
     */
    @Transactional(readOnly = true)
    public List<StatusTotal> statusTotals() {
        return jdbcTemplate.query(
            "SELECT " + STATUS_LABEL + " AS status_label, COUNT(*) AS invoice_count, "
                + "COALESCE(SUM(total_amount), 0) AS amount "
                + "FROM invoices GROUP BY " + STATUS_LABEL + " ORDER BY amount DESC, status_label",
            (rs, rowNum) -> new StatusTotal(
                rs.getString("status_label"),
                rs.getLong("invoice_count"),
                rs.getBigDecimal("amount")
            )
        );
    }

    /**
     * Gross and net income per period, oldest period first.
     *
     * Periods without invoices are absent. Invoices without a date are left out.
     *
     * @param from first invoice date to include, or null for no lower bound
     * @param to last invoice date to include, or null for no upper bound
     */
    @Transactional(readOnly = true)
    public List<IncomeBucket> income(Granularity granularity, LocalDate from, LocalDate to) {
        if (granularity == null) {
            throw new ValidationException("Granularity is required");
        }
        if (from != null && to != null && from.isAfter(to)) {
            throw new ValidationException("Report range starts after it ends: " + from + " > " + to);
        }

        StringBuilder sql = new StringBuilder(
            "SELECT i.invoice_date, "
                + "COALESCE(SUM(ii.quantity * ii.unit_price), 0) AS gross, "
                + "COALESCE(SUM(ii.quantity * COALESCE(p.cost_price, 0)), 0) AS cost, "
                + "COALESCE(SUM(ii.quantity * ii.unit_price * ii.discount / 100), 0) AS discounts "
                + "FROM invoice_items ii "
                + "JOIN invoices i ON i.id = ii.invoice_id "
                + "LEFT JOIN products p ON p.id = ii.product_id "
                + "WHERE i.invoice_date IS NOT NULL");
        List<Object> args = new ArrayList<>();
        if (from != null) {
            sql.append(" AND i.invoice_date >= ?");
            args.add(Date.valueOf(from));
        }
        if (to != null) {
            sql.append(" AND i.invoice_date <= ?");
            args.add(Date.valueOf(to));
        }
        sql.append(" GROUP BY i.invoice_date");

        Map<String, BigDecimal[]> buckets = new TreeMap<>();
        jdbcTemplate.query(sql.toString(), rs -> {
            String period = granularity.bucketOf(rs.getObject("invoice_date", LocalDate.class));
            BigDecimal gross = rs.getBigDecimal("gross");
            BigDecimal net = gross.subtract(rs.getBigDecimal("cost")).subtract(rs.getBigDecimal("discounts"));
            buckets.merge(period, new BigDecimal[] {gross, net},
                (a, b) -> new BigDecimal[] {a[0].add(b[0]), a[1].add(b[1])});
        }, args.toArray());

        List<IncomeBucket> result = new ArrayList<>(buckets.size());
        buckets.forEach((period, sums) -> result.add(new IncomeBucket(period, sums[0], sums[1])));
        log.debug("Income report {} {}..{}: {} buckets", granularity, from, to, result.size());
        return result;
    }

    /**
     * Quantity and revenue per product, highest revenue first. Ad-hoc lines are not counted.
     */
    @Transactional(readOnly = true)
    public List<ProductSales> productSales() {
        return jdbcTemplate.query(
            "SELECT p.name AS product_name, COALESCE(SUM(ii.quantity), 0) AS quantity_sold, "
                + "COALESCE(SUM(ii.line_total), 0) AS revenue "
                + "FROM invoice_items ii JOIN products p ON p.id = ii.product_id "
                + "GROUP BY p.name ORDER BY revenue DESC, product_name",
            (rs, rowNum) -> new ProductSales(
                rs.getString("product_name"),
                rs.getBigDecimal("quantity_sold"),
                rs.getBigDecimal("revenue")
            )
        );
    }
}
