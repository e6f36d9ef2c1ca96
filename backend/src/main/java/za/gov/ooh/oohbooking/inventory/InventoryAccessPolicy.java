package za.gov.ooh.oohbooking.inventory;

import java.util.Objects;
import java.util.UUID;
import org.springframework.stereotype.Component;
import za.gov.ooh.oohbooking.exception.InvalidRequestException;
import za.gov.ooh.oohbooking.security.AuthenticatedUser;
import za.gov.ooh.oohbooking.security.InventoryScope;

/**
 * Decides which inventory rows a caller may read or change. Government roles are unrestricted.
 * Supplier roles are confined to rows owned by their own supplier; a supplier-role caller with no
 * affiliation is confined to nothing.
 */
@Component
public class InventoryAccessPolicy {

  /**
   * The supplier filter a listing must actually apply.
   *
   * @param matchesNothing true when the caller's scope and the requested filter cannot overlap
   * @param supplierId the supplier to filter on, or null for no supplier filter
   */
  public record ListingScope(boolean matchesNothing, UUID supplierId) {

    static ListingScope none() {
      return new ListingScope(true, null);
    }

    static ListingScope of(UUID supplierId) {
      return new ListingScope(false, supplierId);
    }
  }

  public ListingScope scopeListing(AuthenticatedUser caller, UUID requestedSupplierId) {
    if (caller.role().inventoryScope() == InventoryScope.ALL) {
      return ListingScope.of(requestedSupplierId);
    }
    if (caller.supplierId() == null) {
      return ListingScope.none();
    }
    if (requestedSupplierId != null && !requestedSupplierId.equals(caller.supplierId())) {
      return ListingScope.none();
    }
    return ListingScope.of(caller.supplierId());
  }

  public boolean canAccess(AuthenticatedUser caller, InventoryItem item) {
    if (caller.role().inventoryScope() == InventoryScope.ALL) {
      return true;
    }
    return caller.supplierId() != null && Objects.equals(caller.supplierId(), item.getSupplierId());
  }

  /**
   * The supplier a write must be stamped with. Supplier roles always get their own affiliation,
   * whatever the body says; government roles get what they asked for, which may be null.
   *
   * @throws InvalidRequestException if a supplier-role caller has no affiliation
   */
  public UUID resolveOwningSupplier(AuthenticatedUser caller, UUID requestedSupplierId) {
    if (caller.role().inventoryScope() == InventoryScope.ALL) {
      return requestedSupplierId;
    }
    if (caller.supplierId() == null) {
      throw new InvalidRequestException(
          "supplierId", "your account is not affiliated with a supplier");
    }
    return caller.supplierId();
  }
}
