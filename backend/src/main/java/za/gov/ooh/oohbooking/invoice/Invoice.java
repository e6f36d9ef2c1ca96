package za.gov.ooh.oohbooking.invoice;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "invoices")
public class Invoice {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "campaign_id", nullable = false)
  private UUID campaignId;

  @Column(name = "supplier_id")
  private UUID supplierId;

  @Column(name = "invoice_number", nullable = false, unique = true, length = 50)
  private String invoiceNumber;

  @Column(name = "amount", nullable = false, precision = 12, scale = 2)
  private BigDecimal amount;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private InvoiceStatus status;

  @Column(name = "issued_at")
  private Instant issuedAt;

  @Column(name = "due_date")
  private Instant dueDate;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected Invoice() {}

  public Invoice(UUID campaignId, UUID supplierId, String invoiceNumber, BigDecimal amount) {
    this.campaignId = campaignId;
    this.supplierId = supplierId;
    this.invoiceNumber = invoiceNumber;
    this.amount = amount;
    this.status = InvoiceStatus.DRAFT;
    this.createdAt = Instant.now();
  }

  public void bill(UUID campaignId, UUID supplierId, String invoiceNumber, BigDecimal amount) {
    this.campaignId = campaignId;
    this.supplierId = supplierId;
    this.invoiceNumber = invoiceNumber;
    this.amount = amount;
  }

  public void schedule(Instant issuedAt, Instant dueDate) {
    this.issuedAt = issuedAt;
    this.dueDate = dueDate;
  }

  public void changeStatus(InvoiceStatus status) {
    this.status = status;
  }

  public UUID getId() {
    return id;
  }

  public UUID getCampaignId() {
    return campaignId;
  }

  public UUID getSupplierId() {
    return supplierId;
  }

  public String getInvoiceNumber() {
    return invoiceNumber;
  }

  public BigDecimal getAmount() {
    return amount;
  }

  public InvoiceStatus getStatus() {
    return status;
  }

  public Instant getIssuedAt() {
    return issuedAt;
  }

  public Instant getDueDate() {
    return dueDate;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
