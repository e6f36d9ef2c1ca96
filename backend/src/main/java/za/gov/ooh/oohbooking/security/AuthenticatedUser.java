package za.gov.ooh.oohbooking.security;

import java.util.UUID;

/**
 * Snapshot of the calling user, resolved once per request by {@link UserIdentityFilter}.
 *
 * @param supplierId the caller's supplier affiliation, or null for government staff
 */
public record AuthenticatedUser(UUID id, String username, Role role, UUID supplierId) {

  public boolean isSupplierScoped() {
    return role.inventoryScope() == InventoryScope.OWN_SUPPLIER;
  }
}
