package com.flagship.invoice_ledger.ledger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.invoice_ledger.catalog.ProductService;
import com.flagship.invoice_ledger.settings.SettingsService;
import com.flagship.invoice_ledger.support.StoreFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import static com.flagship.invoice_ledger.support.StoreFixtures.stockOf;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * REST mapping of ledger outcomes: 201 on create, 422 with stock details on
 * a shortfall, 409 on a duplicate number, 404 for unknown ids and 400 for
 * malformed requests.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class InvoiceControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private ProductService productService;

    @Autowired
    private SettingsService settingsService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private long widgetId;

    @BeforeEach
    void setUp() {
        StoreFixtures.clearBusinessTables(jdbcTemplate);
        StoreFixtures.resetSettings(settingsService);
        widgetId = StoreFixtures.product(productService, "Widget", 10, "2.50");
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private String invoiceJson(String number, String quantity) {
        return """
            {
              "invoice_number": "%s",
              "invoice_date": "2026-03-14",
              "due_date": "2026-04-14",
              "total_amount": 10.00,
              "status": "Unpaid",
              "items": [
                {"product_id": %d, "description": "Widget", "quantity": %s, "unit_price": 2.50}
              ]
            }
            """.formatted(number, widgetId, quantity);
    }

    @Test
    @DisplayName("POST creates the invoice and GET returns its detail")
    void testCreateAndRead() throws Exception {
        printTestHeader("Create And Read Invoice");

        MvcResult created = mockMvc.perform(post("/api/invoices")
                .contentType(MediaType.APPLICATION_JSON)
                .content(invoiceJson("INV-REST-1", "4")))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.id").isNumber())
            .andReturn();

        JsonNode body = objectMapper.readTree(created.getResponse().getContentAsString());
        long id = body.get("id").asLong();
        printOutput("Created id", id);
        assertEquals(6, stockOf(jdbcTemplate, widgetId));

        mockMvc.perform(get("/api/invoices/{id}", id))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.invoice.invoice_number").value("INV-REST-1"))
            .andExpect(jsonPath("$.invoice.invoice_date").value("2026-03-14"))
            .andExpect(jsonPath("$.items[0].product_name").value("Widget"));

        mockMvc.perform(get("/api/invoices"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].invoice_number").value("INV-REST-1"));
    }

    @Test
    @DisplayName("Stock shortfall is 422 with product, available and requested")
    void testStockShortfall() throws Exception {
        printTestHeader("Stock Shortfall");

        MvcResult result = mockMvc.perform(post("/api/invoices")
                .contentType(MediaType.APPLICATION_JSON)
                .content(invoiceJson("INV-REST-2", "12")))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.error").value("Insufficient Stock"))
            .andExpect(jsonPath("$.details.productId").value(String.valueOf(widgetId)))
            .andExpect(jsonPath("$.details.available").value("10"))
            .andExpect(jsonPath("$.details.requested").value("12"))
            .andReturn();

        printOutput("Response", result.getResponse().getContentAsString());
        assertEquals(10, stockOf(jdbcTemplate, widgetId));
    }

    @Test
    @DisplayName("Duplicate invoice number is 409")
    void testDuplicateNumber() throws Exception {
        mockMvc.perform(post("/api/invoices")
                .contentType(MediaType.APPLICATION_JSON)
                .content(invoiceJson("INV-REST-3", "1")))
            .andExpect(status().isCreated());

        mockMvc.perform(post("/api/invoices")
                .contentType(MediaType.APPLICATION_JSON)
                .content(invoiceJson("INV-REST-3", "1")))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error").value("Conflict"));

        assertEquals(9, stockOf(jdbcTemplate, widgetId));
    }

    @Test
    @DisplayName("Unknown invoice is 404 for read, update and delete")
    void testUnknownInvoice() throws Exception {
        mockMvc.perform(get("/api/invoices/{id}", 987654))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.details.entity").value("Invoice"));

        mockMvc.perform(put("/api/invoices/{id}", 987654)
                .contentType(MediaType.APPLICATION_JSON)
                .content(invoiceJson("INV-REST-4", "1")))
            .andExpect(status().isNotFound());

        mockMvc.perform(delete("/api/invoices/{id}", 987654))
            .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("Update and delete through REST move stock")
    void testUpdateAndDelete() throws Exception {
        MvcResult created = mockMvc.perform(post("/api/invoices")
                .contentType(MediaType.APPLICATION_JSON)
                .content(invoiceJson("INV-REST-5", "4")))
            .andExpect(status().isCreated())
            .andReturn();
        long id = objectMapper.readTree(created.getResponse().getContentAsString()).get("id").asLong();

        mockMvc.perform(put("/api/invoices/{id}", id)
                .contentType(MediaType.APPLICATION_JSON)
                .content(invoiceJson("INV-REST-5", "9")))
            .andExpect(status().isNoContent());
        assertEquals(1, stockOf(jdbcTemplate, widgetId));

        mockMvc.perform(delete("/api/invoices/{id}", id))
            .andExpect(status().isNoContent());
        assertEquals(10, stockOf(jdbcTemplate, widgetId));
    }

    @Test
    @DisplayName("Missing invoice number and negative quantity are 400")
    void testRequestValidation() throws Exception {
        String invalid = """
            {
              "invoice_number": "",
              "items": [ {"product_id": %d, "quantity": -1} ]
            }
            """.formatted(widgetId);

        mockMvc.perform(post("/api/invoices")
                .contentType(MediaType.APPLICATION_JSON)
                .content(invalid))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.details.invoiceNumber").exists())
            .andExpect(jsonPath("$['details']['items[0].quantity']").exists());

        assertEquals(10, stockOf(jdbcTemplate, widgetId));
    }

    @Test
    @DisplayName("Next number endpoint suggests an INV- number")
    void testNextNumber() throws Exception {
        mockMvc.perform(get("/api/invoices/next-number"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.invoice_number").value(startsWith("INV-")));
    }
}
