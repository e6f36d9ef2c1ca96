package za.gov.ooh.oohbooking.document;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Review state of an uploaded document. */
public enum DocumentStatus {
  UPLOADED,
  VALIDATED,
  REJECTED;

  @JsonValue
  public String getValue() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static DocumentStatus from(String value) {
    if (value == null) {
      throw new IllegalArgumentException("Document status must not be null");
    }
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException(
          "Invalid document status: '"
              + value
              + "'. Valid values: uploaded, validated, rejected");
    }
  }
}
