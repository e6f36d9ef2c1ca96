package za.gov.ooh.oohbooking.booking;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Approval and delivery state of a booking. */
public enum BookingStatus {
  PENDING,
  APPROVED,
  REJECTED,
  IN_PROGRESS,
  COMPLETED;

  @JsonValue
  public String getValue() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static BookingStatus from(String value) {
    if (value == null) {
      throw new IllegalArgumentException("Booking status must not be null");
    }
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException(
          "Invalid booking status: '"
              + value
              + "'. Valid values: pending, approved, rejected, in_progress, completed");
    }
  }
}
