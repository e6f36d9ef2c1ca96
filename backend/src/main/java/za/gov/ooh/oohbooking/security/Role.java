package za.gov.ooh.oohbooking.security;

import static za.gov.ooh.oohbooking.security.Capability.ADMINISTER;
import static za.gov.ooh.oohbooking.security.Capability.MANAGE_INVENTORY;
import static za.gov.ooh.oohbooking.security.Capability.VIEW_BOOKINGS;
import static za.gov.ooh.oohbooking.security.Capability.VIEW_CAMPAIGNS;
import static za.gov.ooh.oohbooking.security.Capability.VIEW_DASHBOARD;
import static za.gov.ooh.oohbooking.security.Capability.VIEW_DOCUMENTS;
import static za.gov.ooh.oohbooking.security.Capability.VIEW_INVENTORY;
import static za.gov.ooh.oohbooking.security.Capability.VIEW_INVOICES;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * The six fixed user roles. Government roles see all supplier inventory; supplier roles are
 * scoped to their own supplier's rows.
 *
 * <p>Wire values are the lower-case names ({@code department_admin}, {@code supplier_user}, ...).
 * Spring authorities are {@code ROLE_} followed by the upper-case name.
 */
public enum Role {
  DEPARTMENT_ADMIN(
      InventoryScope.ALL,
      EnumSet.of(
          VIEW_DASHBOARD,
          VIEW_CAMPAIGNS,
          VIEW_BOOKINGS,
          VIEW_INVENTORY,
          MANAGE_INVENTORY,
          VIEW_DOCUMENTS,
          VIEW_INVOICES,
          ADMINISTER)),
  CAMPAIGN_PLANNER(
      InventoryScope.ALL,
      EnumSet.of(VIEW_DASHBOARD, VIEW_CAMPAIGNS, VIEW_BOOKINGS, VIEW_INVENTORY, VIEW_DOCUMENTS)),
  FINANCE_OFFICER(InventoryScope.ALL, EnumSet.of(VIEW_DASHBOARD, VIEW_INVOICES)),
  SUPPLIER_ADMIN(
      InventoryScope.OWN_SUPPLIER,
      EnumSet.of(VIEW_DASHBOARD, VIEW_BOOKINGS, VIEW_INVENTORY, MANAGE_INVENTORY, VIEW_DOCUMENTS)),
  SUPPLIER_USER(
      InventoryScope.OWN_SUPPLIER,
      EnumSet.of(VIEW_DASHBOARD, VIEW_BOOKINGS, VIEW_INVENTORY, MANAGE_INVENTORY, VIEW_DOCUMENTS)),
  AUDITOR(
      InventoryScope.ALL,
      EnumSet.of(
          VIEW_DASHBOARD,
          VIEW_CAMPAIGNS,
          VIEW_BOOKINGS,
          VIEW_INVENTORY,
          VIEW_DOCUMENTS,
          VIEW_INVOICES));

  private final InventoryScope inventoryScope;
  private final Set<Capability> capabilities;

  Role(InventoryScope inventoryScope, Set<Capability> capabilities) {
    this.inventoryScope = inventoryScope;
    this.capabilities = capabilities;
  }

  public InventoryScope inventoryScope() {
    return inventoryScope;
  }

  public boolean isSupplierRole() {
    return inventoryScope == InventoryScope.OWN_SUPPLIER;
  }

  public boolean can(Capability capability) {
    return capabilities.contains(capability);
  }

  /** Returns a copy of the capability set, in declaration order. */
  public Set<Capability> capabilities() {
    return EnumSet.copyOf(capabilities);
  }

  public String authority() {
    return "ROLE_" + name();
  }

  @JsonValue
  public String getValue() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Case-insensitive lookup from the wire value.
   *
   * @throws IllegalArgumentException if the value names no role
   */
  @JsonCreator
  public static Role from(String value) {
    if (value == null) {
      throw new IllegalArgumentException("Role must not be null");
    }
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException(
          "Invalid role: '"
              + value
              + "'. Valid values: department_admin, campaign_planner, finance_officer,"
              + " supplier_admin, supplier_user, auditor");
    }
  }
}
