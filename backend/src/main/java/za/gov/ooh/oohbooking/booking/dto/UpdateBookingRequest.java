package za.gov.ooh.oohbooking.booking.dto;

import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;
import za.gov.ooh.oohbooking.booking.BookingStatus;

/** Partial update. Null fields are left unchanged. */
public record UpdateBookingRequest(
    UUID campaignId,
    UUID supplierId,
    UUID inventoryItemId,
    @Pattern(regexp = ".*\\S.*", message = "siteDescription must not be blank") @Size(max = 1000)
        String siteDescription,
    @Size(max = 500) String location,
    @Size(max = 100) String mediaType,
    @Digits(integer = 10, fraction = 2) @PositiveOrZero BigDecimal cost,
    BookingStatus status,
    Instant startDate,
    Instant endDate) {}
