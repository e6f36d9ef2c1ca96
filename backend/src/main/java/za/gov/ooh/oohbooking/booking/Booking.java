package za.gov.ooh.oohbooking.booking;

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

/** A site placed with a supplier as part of a campaign. */
@Entity
@Table(name = "bookings")
public class Booking {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "campaign_id", nullable = false)
  private UUID campaignId;

  @Column(name = "supplier_id", nullable = false)
  private UUID supplierId;

  @Column(name = "inventory_item_id")
  private UUID inventoryItemId;

  @Column(name = "site_description", nullable = false, length = 1000)
  private String siteDescription;

  @Column(name = "location", length = 500)
  private String location;

  @Column(name = "media_type", length = 100)
  private String mediaType;

  @Column(name = "cost", precision = 12, scale = 2)
  private BigDecimal cost;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private BookingStatus status;

  @Column(name = "start_date")
  private Instant startDate;

  @Column(name = "end_date")
  private Instant endDate;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected Booking() {}

  public Booking(UUID campaignId, UUID supplierId, String siteDescription) {
    this.campaignId = campaignId;
    this.supplierId = supplierId;
    this.siteDescription = siteDescription;
    this.status = BookingStatus.PENDING;
    this.createdAt = Instant.now();
  }

  public void assign(UUID campaignId, UUID supplierId, UUID inventoryItemId) {
    this.campaignId = campaignId;
    this.supplierId = supplierId;
    this.inventoryItemId = inventoryItemId;
  }

  public void describeSite(String siteDescription, String location, String mediaType) {
    this.siteDescription = siteDescription;
    this.location = location;
    this.mediaType = mediaType;
  }

  public void schedule(BigDecimal cost, Instant startDate, Instant endDate) {
    this.cost = cost;
    this.startDate = startDate;
    this.endDate = endDate;
  }

  public void changeStatus(BookingStatus status) {
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

  public UUID getInventoryItemId() {
    return inventoryItemId;
  }

  public String getSiteDescription() {
    return siteDescription;
  }

  public String getLocation() {
    return location;
  }

  public String getMediaType() {
    return mediaType;
  }

  public BigDecimal getCost() {
    return cost;
  }

  public BookingStatus getStatus() {
    return status;
  }

  public Instant getStartDate() {
    return startDate;
  }

  public Instant getEndDate() {
    return endDate;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
