package za.gov.ooh.oohbooking.campaign.dto;

import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;
import za.gov.ooh.oohbooking.campaign.CampaignStatus;

/** {@code status} defaults to draft and {@code createdBy} to the caller. */
public record CreateCampaignRequest(
    @NotBlank(message = "name is required") @Size(max = 255) String name,
    @Size(max = 4000) String description,
    CampaignStatus status,
    @Digits(integer = 10, fraction = 2) @PositiveOrZero BigDecimal budget,
    Instant startDate,
    Instant endDate,
    @Size(max = 100) String region,
    @PositiveOrZero Integer targetReach,
    UUID createdBy) {}
