package za.gov.ooh.oohbooking.invoice.dto;

import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;
import za.gov.ooh.oohbooking.invoice.InvoiceStatus;

/** Partial update. Null fields are left unchanged. */
public record UpdateInvoiceRequest(
    UUID campaignId,
    UUID supplierId,
    @Pattern(regexp = ".*\\S.*", message = "invoiceNumber must not be blank") @Size(max = 50)
        String invoiceNumber,
    @Digits(integer = 10, fraction = 2) BigDecimal amount,
    InvoiceStatus status,
    Instant issuedAt,
    Instant dueDate) {}
