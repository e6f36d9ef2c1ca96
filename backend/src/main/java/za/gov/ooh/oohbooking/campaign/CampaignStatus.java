package za.gov.ooh.oohbooking.campaign;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Campaign lifecycle. Any status may move to any other. */
public enum CampaignStatus {
  DRAFT,
  PENDING_APPROVAL,
  APPROVED,
  IN_PROGRESS,
  COMPLETED,
  CANCELLED;

  @JsonValue
  public String getValue() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static CampaignStatus from(String value) {
    if (value == null) {
      throw new IllegalArgumentException("Campaign status must not be null");
    }
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException(
          "Invalid campaign status: '"
              + value
              + "'. Valid values: draft, pending_approval, approved, in_progress, completed, cancelled");
    }
  }
}
