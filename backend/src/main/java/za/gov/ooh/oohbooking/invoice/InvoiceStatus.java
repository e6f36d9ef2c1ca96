package za.gov.ooh.oohbooking.invoice;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum InvoiceStatus {
  DRAFT,
  SENT,
  PAID,
  OVERDUE;

  @JsonValue
  public String getValue() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static InvoiceStatus from(String value) {
    if (value == null) {
      throw new IllegalArgumentException("Invoice status must not be null");
    }
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException(
          "Invalid invoice status: '"
              + value
              + "'. Valid values: draft, sent, paid, overdue");
    }
  }
}
