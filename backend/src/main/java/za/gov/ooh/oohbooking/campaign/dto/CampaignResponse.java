package za.gov.ooh.oohbooking.campaign.dto;

import java.time.Instant;
import java.util.UUID;
import za.gov.ooh.oohbooking.campaign.Campaign;
import za.gov.ooh.oohbooking.campaign.CampaignStatus;
import za.gov.ooh.oohbooking.common.Amounts;

public record CampaignResponse(
    UUID id,
    String name,
    String description,
    CampaignStatus status,
    String budget,
    Instant startDate,
    Instant endDate,
    String region,
    Integer targetReach,
    UUID createdBy,
    Instant createdAt) {

  public static CampaignResponse from(Campaign campaign) {
    return new CampaignResponse(
        campaign.getId(),
        campaign.getName(),
        campaign.getDescription(),
        campaign.getStatus(),
        Amounts.format(campaign.getBudget()),
        campaign.getStartDate(),
        campaign.getEndDate(),
        campaign.getRegion(),
        campaign.getTargetReach(),
        campaign.getCreatedBy(),
        campaign.getCreatedAt());
  }
}
