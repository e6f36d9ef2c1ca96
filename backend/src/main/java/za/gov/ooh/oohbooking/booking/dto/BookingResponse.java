package za.gov.ooh.oohbooking.booking.dto;

import java.time.Instant;
import java.util.UUID;
import za.gov.ooh.oohbooking.booking.Booking;
import za.gov.ooh.oohbooking.booking.BookingStatus;
import za.gov.ooh.oohbooking.common.Amounts;

public record BookingResponse(
    UUID id,
    UUID campaignId,
    UUID supplierId,
    UUID inventoryItemId,
    String siteDescription,
    String location,
    String mediaType,
    String cost,
    BookingStatus status,
    Instant startDate,
    Instant endDate,
    Instant createdAt) {

  public static BookingResponse from(Booking booking) {
    return new BookingResponse(
        booking.getId(),
        booking.getCampaignId(),
        booking.getSupplierId(),
        booking.getInventoryItemId(),
        booking.getSiteDescription(),
        booking.getLocation(),
        booking.getMediaType(),
        Amounts.format(booking.getCost()),
        booking.getStatus(),
        booking.getStartDate(),
        booking.getEndDate(),
        booking.getCreatedAt());
  }
}
