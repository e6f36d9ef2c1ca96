package za.gov.ooh.oohbooking.supplier.dto;

import java.time.Instant;
import java.util.UUID;
import za.gov.ooh.oohbooking.supplier.Supplier;

public record SupplierResponse(
    UUID id,
    String name,
    String contactPerson,
    String email,
    String phone,
    String address,
    boolean active,
    Instant createdAt) {

  public static SupplierResponse from(Supplier supplier) {
    return new SupplierResponse(
        supplier.getId(),
        supplier.getName(),
        supplier.getContactPerson(),
        supplier.getEmail(),
        supplier.getPhone(),
        supplier.getAddress(),
        supplier.isActive(),
        supplier.getCreatedAt());
  }
}
