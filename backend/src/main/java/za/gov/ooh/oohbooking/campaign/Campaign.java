package za.gov.ooh.oohbooking.campaign;

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
@Table(name = "campaigns")
public class Campaign {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "name", nullable = false, length = 255)
  private String name;

  @Column(name = "description", length = 4000)
  private String description;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 30)
  private CampaignStatus status;

  @Column(name = "budget", precision = 12, scale = 2)
  private BigDecimal budget;

  @Column(name = "start_date")
  private Instant startDate;

  @Column(name = "end_date")
  private Instant endDate;

  @Column(name = "region", length = 100)
  private String region;

  @Column(name = "target_reach")
  private Integer targetReach;

  @Column(name = "created_by", nullable = false)
  private UUID createdBy;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected Campaign() {}

  public Campaign(String name, String description, UUID createdBy) {
    this.name = name;
    this.description = description;
    this.status = CampaignStatus.DRAFT;
    this.createdBy = createdBy;
    this.createdAt = Instant.now();
  }

  public void updateDetails(String name, String description, String region, Integer targetReach) {
    this.name = name;
    this.description = description;
    this.region = region;
    this.targetReach = targetReach;
  }

  public void plan(BigDecimal budget, Instant startDate, Instant endDate) {
    this.budget = budget;
    this.startDate = startDate;
    this.endDate = endDate;
  }

  public void changeStatus(CampaignStatus status) {
    this.status = status;
  }

  public UUID getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public String getDescription() {
    return description;
  }

  public CampaignStatus getStatus() {
    return status;
  }

  public BigDecimal getBudget() {
    return budget;
  }

  public Instant getStartDate() {
    return startDate;
  }

  public Instant getEndDate() {
    return endDate;
  }

  public String getRegion() {
    return region;
  }

  public Integer getTargetReach() {
    return targetReach;
  }

  public UUID getCreatedBy() {
    return createdBy;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
