package za.gov.ooh.oohbooking.inventory.dto;

import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;
import za.gov.ooh.oohbooking.common.GeoPatterns;
import za.gov.ooh.oohbooking.inventory.InventoryStatus;

/** Partial update. Null fields are left unchanged. */
public record UpdateInventoryItemRequest(
    UUID supplierId,
    @Pattern(regexp = ".*\\S.*", message = "screenName must not be blank") @Size(max = 255)
        String screenName,
    @Pattern(regexp = ".*\\S.*", message = "screenType must not be blank") @Size(max = 100)
        String screenType,
    @Pattern(regexp = ".*\\S.*", message = "location must not be blank") @Size(max = 500)
        String location,
    @Pattern(regexp = ".*\\S.*", message = "region must not be blank") @Size(max = 100)
        String region,
    @Pattern(regexp = GeoPatterns.LATITUDE, message = GeoPatterns.LATITUDE_MESSAGE)
        String gpsLatitude,
    @Pattern(regexp = GeoPatterns.LONGITUDE, message = GeoPatterns.LONGITUDE_MESSAGE)
        String gpsLongitude,
    @Size(max = 100) String dimensions,
    @Size(max = 100) String resolution,
    @Size(max = 100) String facing,
    @Digits(integer = 8, fraction = 2) @PositiveOrZero BigDecimal dailyRate,
    @Digits(integer = 8, fraction = 2) @PositiveOrZero BigDecimal weeklyRate,
    @Digits(integer = 10, fraction = 2) @PositiveOrZero BigDecimal monthlyRate,
    InventoryStatus status,
    Instant availableFrom,
    Instant availableTo,
    Boolean illuminated,
    Boolean digital,
    @PositiveOrZero Integer trafficCount,
    @Size(max = 4000) String notes,
    Boolean active) {}
