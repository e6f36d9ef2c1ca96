package za.gov.ooh.oohbooking.booking.dto;

import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;
import za.gov.ooh.oohbooking.booking.BookingStatus;

public record CreateBookingRequest(
    @NotNull(message = "campaignId is required") UUID campaignId,
    @NotNull(message = "supplierId is required") UUID supplierId,
    UUID inventoryItemId,
    @NotBlank(message = "siteDescription is required") @Size(max = 1000) String siteDescription,
    @Size(max = 500) String location,
    @Size(max = 100) String mediaType,
    @Digits(integer = 10, fraction = 2) @PositiveOrZero BigDecimal cost,
    BookingStatus status,
    Instant startDate,
    Instant endDate) {}
