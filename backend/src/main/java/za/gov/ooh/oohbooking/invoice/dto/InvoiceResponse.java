package za.gov.ooh.oohbooking.invoice.dto;

import java.time.Instant;
import java.util.UUID;
import za.gov.ooh.oohbooking.common.Amounts;
import za.gov.ooh.oohbooking.invoice.Invoice;
import za.gov.ooh.oohbooking.invoice.InvoiceStatus;

public record InvoiceResponse(
    UUID id,
    UUID campaignId,
    UUID supplierId,
    String invoiceNumber,
    String amount,
    InvoiceStatus status,
    Instant issuedAt,
    Instant dueDate,
    Instant createdAt) {

  public static InvoiceResponse from(Invoice invoice) {
    return new InvoiceResponse(
        invoice.getId(),
        invoice.getCampaignId(),
        invoice.getSupplierId(),
        invoice.getInvoiceNumber(),
        Amounts.format(invoice.getAmount()),
        invoice.getStatus(),
        invoice.getIssuedAt(),
        invoice.getDueDate(),
        invoice.getCreatedAt());
  }
}
