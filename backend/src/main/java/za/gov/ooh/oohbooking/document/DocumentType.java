package za.gov.ooh.oohbooking.document;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum DocumentType {
  ARTWORK,
  PROOF_OF_FLIGHTING,
  COMPLIANCE_SBD,
  COMPLIANCE_CSO,
  INVOICE,
  OTHER;

  @JsonValue
  public String getValue() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static DocumentType from(String value) {
    if (value == null) {
      throw new IllegalArgumentException("Document type must not be null");
    }
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException(
          "Invalid document type: '"
              + value
              + "'. Valid values: artwork, proof_of_flighting, compliance_sbd, compliance_cso, invoice, other");
    }
  }
}
