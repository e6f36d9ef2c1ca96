package za.gov.ooh.oohbooking.inventory;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Availability of a screen or site. Transitions are unconstrained. */
public enum InventoryStatus {
  AVAILABLE,
  BOOKED,
  MAINTENANCE,
  RESERVED;

  @JsonValue
  public String getValue() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static InventoryStatus from(String value) {
    if (value == null) {
      throw new IllegalArgumentException("Inventory status must not be null");
    }
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException(
          "Invalid inventory status: '"
              + value
              + "'. Valid values: available, booked, maintenance, reserved");
    }
  }
}
