package za.gov.ooh.oohbooking.inventory.dto;

import java.time.Instant;
import java.util.UUID;
import za.gov.ooh.oohbooking.common.Amounts;
import za.gov.ooh.oohbooking.inventory.InventoryItem;
import za.gov.ooh.oohbooking.inventory.InventoryStatus;

public record InventoryItemResponse(
    UUID id,
    UUID supplierId,
    String screenName,
    String screenType,
    String location,
    String region,
    String gpsLatitude,
    String gpsLongitude,
    String dimensions,
    String resolution,
    String facing,
    String dailyRate,
    String weeklyRate,
    String monthlyRate,
    InventoryStatus status,
    Instant availableFrom,
    Instant availableTo,
    boolean illuminated,
    boolean digital,
    Integer trafficCount,
    String notes,
    boolean active,
    Instant updatedAt) {

  public static InventoryItemResponse from(InventoryItem item) {
    return new InventoryItemResponse(
        item.getId(),
        item.getSupplierId(),
        item.getScreenName(),
        item.getScreenType(),
        item.getLocation(),
        item.getRegion(),
        item.getGpsLatitude(),
        item.getGpsLongitude(),
        item.getDimensions(),
        item.getResolution(),
        item.getFacing(),
        Amounts.format(item.getDailyRate()),
        Amounts.format(item.getWeeklyRate()),
        Amounts.format(item.getMonthlyRate()),
        item.getStatus(),
        item.getAvailableFrom(),
        item.getAvailableTo(),
        item.isIlluminated(),
        item.isDigital(),
        item.getTrafficCount(),
        item.getNotes(),
        item.isActive(),
        item.getUpdatedAt());
  }
}
