package za.gov.ooh.oohbooking.security;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Application areas a role may use. Returned to clients to drive navigation. */
public enum Capability {
  VIEW_DASHBOARD,
  VIEW_CAMPAIGNS,
  VIEW_BOOKINGS,
  VIEW_INVENTORY,
  MANAGE_INVENTORY,
  VIEW_DOCUMENTS,
  VIEW_INVOICES,
  ADMINISTER;

  @JsonValue
  public String getValue() {
    return name().toLowerCase(Locale.ROOT);
  }
}
