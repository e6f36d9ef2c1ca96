package za.gov.ooh.oohbooking.user.dto;

import java.time.Instant;
import java.util.UUID;
import za.gov.ooh.oohbooking.security.Role;
import za.gov.ooh.oohbooking.user.AppUser;

/** User as seen by clients. The password hash is never part of it. */
public record UserResponse(
    UUID id,
    String username,
    String fullName,
    String email,
    Role role,
    UUID supplierId,
    boolean active,
    Instant createdAt) {

  public static UserResponse from(AppUser user) {
    return new UserResponse(
        user.getId(),
        user.getUsername(),
        user.getFullName(),
        user.getEmail(),
        user.getRole(),
        user.getSupplierId(),
        user.isActive(),
        user.getCreatedAt());
  }
}
