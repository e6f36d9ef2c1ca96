package za.gov.ooh.oohbooking.campaign.dto;

import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.time.Instant;
import za.gov.ooh.oohbooking.campaign.CampaignStatus;

/** Partial update. Null fields are left unchanged. */
public record UpdateCampaignRequest(
    @Pattern(regexp = ".*\\S.*", message = "name must not be blank") @Size(max = 255) String name,
    @Size(max = 4000) String description,
    CampaignStatus status,
    @Digits(integer = 10, fraction = 2) @PositiveOrZero BigDecimal budget,
    Instant startDate,
    Instant endDate,
    @Size(max = 100) String region,
    @PositiveOrZero Integer targetReach) {}
