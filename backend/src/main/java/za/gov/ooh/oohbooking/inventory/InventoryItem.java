package za.gov.ooh.oohbooking.inventory;

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

/**
 * A supplier-owned screen or site that can be booked. Every mutator refreshes {@code updatedAt}.
 */
@Entity
@Table(name = "inventory_items")
public class InventoryItem {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "supplier_id", nullable = false)
  private UUID supplierId;

  @Column(name = "screen_name", nullable = false, length = 255)
  private String screenName;

  @Column(name = "screen_type", nullable = false, length = 100)
  private String screenType;

  @Column(name = "location", nullable = false, length = 500)
  private String location;

  @Column(name = "region", nullable = false, length = 100)
  private String region;

  @Column(name = "gps_latitude", length = 30)
  private String gpsLatitude;

  @Column(name = "gps_longitude", length = 30)
  private String gpsLongitude;

  @Column(name = "dimensions", length = 100)
  private String dimensions;

  @Column(name = "resolution", length = 100)
  private String resolution;

  @Column(name = "facing", length = 100)
  private String facing;

  @Column(name = "daily_rate", nullable = false, precision = 10, scale = 2)
  private BigDecimal dailyRate;

  @Column(name = "weekly_rate", precision = 10, scale = 2)
  private BigDecimal weeklyRate;

  @Column(name = "monthly_rate", precision = 12, scale = 2)
  private BigDecimal monthlyRate;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private InventoryStatus status;

  @Column(name = "available_from")
  private Instant availableFrom;

  @Column(name = "available_to")
  private Instant availableTo;

  @Column(name = "illuminated", nullable = false)
  private boolean illuminated;

  @Column(name = "digital", nullable = false)
  private boolean digital;

  @Column(name = "traffic_count")
  private Integer trafficCount;

  @Column(name = "notes", length = 4000)
  private String notes;

  @Column(name = "active", nullable = false)
  private boolean active;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected InventoryItem() {}

  public InventoryItem(
      UUID supplierId,
      String screenName,
      String screenType,
      String location,
      String region,
      BigDecimal dailyRate) {
    this.supplierId = supplierId;
    this.screenName = screenName;
    this.screenType = screenType;
    this.location = location;
    this.region = region;
    this.dailyRate = dailyRate;
    this.status = InventoryStatus.AVAILABLE;
    this.active = true;
    this.updatedAt = Instant.now();
  }

  public void assignSupplier(UUID supplierId) {
    this.supplierId = supplierId;
    this.updatedAt = Instant.now();
  }

  public void describe(String screenName, String screenType, String location, String region) {
    this.screenName = screenName;
    this.screenType = screenType;
    this.location = location;
    this.region = region;
    this.updatedAt = Instant.now();
  }

  public void locate(String gpsLatitude, String gpsLongitude, String facing) {
    this.gpsLatitude = gpsLatitude;
    this.gpsLongitude = gpsLongitude;
    this.facing = facing;
    this.updatedAt = Instant.now();
  }

  public void specify(
      String dimensions,
      String resolution,
      boolean illuminated,
      boolean digital,
      Integer trafficCount) {
    this.dimensions = dimensions;
    this.resolution = resolution;
    this.illuminated = illuminated;
    this.digital = digital;
    this.trafficCount = trafficCount;
    this.updatedAt = Instant.now();
  }

  public void price(BigDecimal dailyRate, BigDecimal weeklyRate, BigDecimal monthlyRate) {
    this.dailyRate = dailyRate;
    this.weeklyRate = weeklyRate;
    this.monthlyRate = monthlyRate;
    this.updatedAt = Instant.now();
  }

  public void changeAvailability(
      InventoryStatus status, Instant availableFrom, Instant availableTo) {
    this.status = status;
    this.availableFrom = availableFrom;
    this.availableTo = availableTo;
    this.updatedAt = Instant.now();
  }

  public void updateNotes(String notes) {
    this.notes = notes;
    this.updatedAt = Instant.now();
  }

  public void activate() {
    this.active = true;
    this.updatedAt = Instant.now();
  }

  public void deactivate() {
    this.active = false;
    this.updatedAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public UUID getSupplierId() {
    return supplierId;
  }

  public String getScreenName() {
    return screenName;
  }

  public String getScreenType() {
    return screenType;
  }

  public String getLocation() {
    return location;
  }

  public String getRegion() {
    return region;
  }

  public String getGpsLatitude() {
    return gpsLatitude;
  }

  public String getGpsLongitude() {
    return gpsLongitude;
  }

  public String getDimensions() {
    return dimensions;
  }

  public String getResolution() {
    return resolution;
  }

  public String getFacing() {
    return facing;
  }

  public BigDecimal getDailyRate() {
    return dailyRate;
  }

  public BigDecimal getWeeklyRate() {
    return weeklyRate;
  }

  public BigDecimal getMonthlyRate() {
    return monthlyRate;
  }

  public InventoryStatus getStatus() {
    return status;
  }

  public Instant getAvailableFrom() {
    return availableFrom;
  }

  public Instant getAvailableTo() {
    return availableTo;
  }

  public boolean isIlluminated() {
    return illuminated;
  }

  public boolean isDigital() {
    return digital;
  }

  public Integer getTrafficCount() {
    return trafficCount;
  }

  public String getNotes() {
    return notes;
  }

  public boolean isActive() {
    return active;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
