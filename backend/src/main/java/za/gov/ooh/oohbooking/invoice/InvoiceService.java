package za.gov.ooh.oohbooking.invoice;

import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import za.gov.ooh.oohbooking.campaign.CampaignService;
import za.gov.ooh.oohbooking.exception.ResourceConflictException;
import za.gov.ooh.oohbooking.exception.ResourceNotFoundException;
import za.gov.ooh.oohbooking.invoice.dto.CreateInvoiceRequest;
import za.gov.ooh.oohbooking.invoice.dto.UpdateInvoiceRequest;
import za.gov.ooh.oohbooking.supplier.SupplierService;

@Service
public class InvoiceService {

  private static final Logger log = LoggerFactory.getLogger(InvoiceService.class);

  private final InvoiceRepository invoiceRepository;
  private final CampaignService campaignService;
  private final SupplierService supplierService;

  public InvoiceService(
      InvoiceRepository invoiceRepository,
      CampaignService campaignService,
      SupplierService supplierService) {
    this.invoiceRepository = invoiceRepository;
    this.campaignService = campaignService;
    this.supplierService = supplierService;
  }

  @Transactional(readOnly = true)
  public List<Invoice> listInvoices(UUID campaignId, UUID supplierId, InvoiceStatus status) {
    return invoiceRepository.findByFilters(campaignId, supplierId, status);
  }

  @Transactional(readOnly = true)
  public Invoice getInvoice(UUID id) {
    return invoiceRepository
        .findById(id)
        .orElseThrow(() -> new ResourceNotFoundException("Invoice", id));
  }

  @Transactional
  public Invoice createInvoice(CreateInvoiceRequest request) {
    String invoiceNumber = request.invoiceNumber().trim();
    requireUniqueNumber(invoiceNumber);
    campaignService.requireExists("campaignId", request.campaignId());
    if (request.supplierId() != null) {
      supplierService.requireExists("supplierId", request.supplierId());
    }

    var invoice =
        new Invoice(request.campaignId(), request.supplierId(), invoiceNumber, request.amount());
    invoice.schedule(request.issuedAt(), request.dueDate());
    if (request.status() != null) {
      invoice.changeStatus(request.status());
    }

    invoice = invoiceRepository.save(invoice);
    log.info(
        "Created invoice {} ({}) for campaign {}",
        invoice.getId(),
        invoiceNumber,
        invoice.getCampaignId());
    return invoice;
  }

  @Transactional
  public Invoice updateInvoice(UUID id, UpdateInvoiceRequest request) {
    var invoice = getInvoice(id);

    String invoiceNumber =
        request.invoiceNumber() != null
            ? request.invoiceNumber().trim()
            : invoice.getInvoiceNumber();
    if (!invoiceNumber.equals(invoice.getInvoiceNumber())) {
      requireUniqueNumber(invoiceNumber);
    }
    if (request.campaignId() != null) {
      campaignService.requireExists("campaignId", request.campaignId());
    }
    if (request.supplierId() != null) {
      supplierService.requireExists("supplierId", request.supplierId());
    }

    invoice.bill(
        request.campaignId() != null ? request.campaignId() : invoice.getCampaignId(),
        request.supplierId() != null ? request.supplierId() : invoice.getSupplierId(),
        invoiceNumber,
        request.amount() != null ? request.amount() : invoice.getAmount());
    invoice.schedule(
        request.issuedAt() != null ? request.issuedAt() : invoice.getIssuedAt(),
        request.dueDate() != null ? request.dueDate() : invoice.getDueDate());

    if (request.status() != null && request.status() != invoice.getStatus()) {
      log.info("Invoice {} status {} -> {}", id, invoice.getStatus(), request.status());
      invoice.changeStatus(request.status());
    }
    return invoiceRepository.save(invoice);
  }

  @Transactional
  public void deleteInvoice(UUID id) {
    var invoice = getInvoice(id);
    invoiceRepository.delete(invoice);
    log.info("Deleted invoice {} ({})", id, invoice.getInvoiceNumber());
  }

  private void requireUniqueNumber(String invoiceNumber) {
    if (invoiceRepository.existsByInvoiceNumber(invoiceNumber)) {
      throw new ResourceConflictException(
          "Duplicate invoice number", "Invoice number '" + invoiceNumber + "' is already in use");
    }
  }
}
