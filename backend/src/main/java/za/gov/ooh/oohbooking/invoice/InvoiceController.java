package za.gov.ooh.oohbooking.invoice;

import jakarta.validation.Valid;
import java.net.URI;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import za.gov.ooh.oohbooking.invoice.dto.CreateInvoiceRequest;
import za.gov.ooh.oohbooking.invoice.dto.InvoiceResponse;
import za.gov.ooh.oohbooking.invoice.dto.UpdateInvoiceRequest;

@RestController
@RequestMapping("/api/invoices")
public class InvoiceController {

  private final InvoiceService invoiceService;

  public InvoiceController(InvoiceService invoiceService) {
    this.invoiceService = invoiceService;
  }

  @GetMapping
  public ResponseEntity<List<InvoiceResponse>> listInvoices(
      @RequestParam(required = false) UUID campaignId,
      @RequestParam(required = false) UUID supplierId,
      @RequestParam(required = false) InvoiceStatus status) {
    var invoices =
        invoiceService.listInvoices(campaignId, supplierId, status).stream()
            .map(InvoiceResponse::from)
            .toList();
    return ResponseEntity.ok(invoices);
  }

  @GetMapping("/{id}")
  public ResponseEntity<InvoiceResponse> getInvoice(@PathVariable UUID id) {
    return ResponseEntity.ok(InvoiceResponse.from(invoiceService.getInvoice(id)));
  }

  @PostMapping
  public ResponseEntity<InvoiceResponse> createInvoice(
      @Valid @RequestBody CreateInvoiceRequest request) {
    var invoice = invoiceService.createInvoice(request);
    return ResponseEntity.created(URI.create("/api/invoices/" + invoice.getId()))
        .body(InvoiceResponse.from(invoice));
  }

  @PatchMapping("/{id}")
  public ResponseEntity<InvoiceResponse> updateInvoice(
      @PathVariable UUID id, @Valid @RequestBody UpdateInvoiceRequest request) {
    return ResponseEntity.ok(InvoiceResponse.from(invoiceService.updateInvoice(id, request)));
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<Void> deleteInvoice(@PathVariable UUID id) {
    invoiceService.deleteInvoice(id);
    return ResponseEntity.noContent().build();
  }
}
