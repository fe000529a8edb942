package com.flagship.invoice_ledger.report;

import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/api/reports")
@RequiredArgsConstructor
public class ReportController {

    private final ReportService reportService;

    @GetMapping("/totals")
    public TotalsSummary totals() {
        return reportService.totals();
    }

    @GetMapping("/status-totals")
    public List<StatusTotal> statusTotals() {
        return reportService.statusTotals();
    }

    @GetMapping("/income")
    public List<IncomeBucket> income(
            @RequestParam(name = "granularity", defaultValue = "MONTHLY") Granularity granularity,
            @RequestParam(name = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(name = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        return reportService.income(granularity, from, to);
    }

    @GetMapping("/product-sales")
    public List<ProductSales> productSales() {
        return reportService.productSales();
    }
}
