package za.gov.ooh.oohbooking.inventory.dto;

import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;
import za.gov.ooh.oohbooking.common.GeoPatterns;
import za.gov.ooh.oohbooking.inventory.InventoryStatus;

/**
 * {@code supplierId} is required for government callers and ignored for supplier callers, whose
 * own affiliation is used instead.
 */
public record CreateInventoryItemRequest(
    UUID supplierId,
    @NotBlank(message = "screenName is required") @Size(max = 255) String screenName,
    @NotBlank(message = "screenType is required") @Size(max = 100) String screenType,
    @NotBlank(message = "location is required") @Size(max = 500) String location,
    @NotBlank(message = "region is required") @Size(max = 100) String region,
    @Pattern(regexp = GeoPatterns.LATITUDE, message = GeoPatterns.LATITUDE_MESSAGE)
        String gpsLatitude,
    @Pattern(regexp = GeoPatterns.LONGITUDE, message = GeoPatterns.LONGITUDE_MESSAGE)
        String gpsLongitude,
    @Size(max = 100) String dimensions,
    @Size(max = 100) String resolution,
    @Size(max = 100) String facing,
    @NotNull(message = "dailyRate is required")
        @Digits(integer = 8, fraction = 2)
        @PositiveOrZero
        BigDecimal dailyRate,
    @Digits(integer = 8, fraction = 2) @PositiveOrZero BigDecimal weeklyRate,
    @Digits(integer = 10, fraction = 2) @PositiveOrZero BigDecimal monthlyRate,
    InventoryStatus status,
    Instant availableFrom,
    Instant availableTo,
    Boolean illuminated,
    Boolean digital,
    @PositiveOrZero Integer trafficCount,
    @Size(max = 4000) String notes) {}
