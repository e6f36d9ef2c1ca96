package za.gov.ooh.oohbooking.invoice.dto;

import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;
import za.gov.ooh.oohbooking.invoice.InvoiceStatus;

public record CreateInvoiceRequest(
    @NotNull(message = "campaignId is required") UUID campaignId,
    UUID supplierId,
    @NotBlank(message = "invoiceNumber is required") @Size(max = 50) String invoiceNumber,
    @NotNull(message = "amount is required") @Digits(integer = 10, fraction = 2) BigDecimal amount,
    InvoiceStatus status,
    Instant issuedAt,
    Instant dueDate) {}
