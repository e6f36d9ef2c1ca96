package za.gov.ooh.oohbooking.client;

import java.time.Instant;
import java.util.UUID;
import za.gov.ooh.oohbooking.security.Role;

/** The identity a client keeps between runs: who is signed in and the token that proves it. */
public record StoredSession(
    UUID userId, String username, Role role, UUID supplierId, String token, Instant expiresAt) {

  public boolean isExpired(Instant now) {
    return expiresAt != null && !expiresAt.isAfter(now);
  }
}
