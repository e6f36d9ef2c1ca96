package za.gov.ooh.oohbooking.security;

/** How much of the supplier inventory a role may see and change. */
public enum InventoryScope {
  /** Every supplier's items. */
  ALL,

  /** Only items owned by the caller's own supplier. */
  OWN_SUPPLIER
}
