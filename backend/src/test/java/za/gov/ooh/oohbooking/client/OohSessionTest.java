package za.gov.ooh.oohbooking.client;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Set;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import za.gov.ooh.oohbooking.security.Capability;
import za.gov.ooh.oohbooking.security.Role;
import za.gov.ooh.oohbooking.user.AuthController.LoginResponse;

class OohSessionTest {

  private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");
  private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

  private static StoredSession storedUntil(Instant expiresAt) {
    return new StoredSession(
        UUID.randomUUID(), "planner", Role.CAMPAIGN_PLANNER, null, "token", expiresAt);
  }

  @Test
  void loadRestoresUnexpiredSession() {
    var store = new InMemorySessionStore();
    store.save(storedUntil(NOW.plusSeconds(60)));
    var session = new OohSession(store, clock);

    assertThat(session.load()).isPresent();
    assertThat(session.isSignedIn()).isTrue();
  }

  @Test
  void loadDiscardsExpiredSession() {
    var store = new InMemorySessionStore();
    store.save(storedUntil(NOW.minusSeconds(1)));
    var session = new OohSession(store, clock);

    assertThat(session.load()).isEmpty();
    assertThat(session.isSignedIn()).isFalse();
    assertThat(store.load()).isEmpty();
  }

  @Test
  void startPersistsLoginAndClearRemovesIt() {
    var store = new InMemorySessionStore();
    var session = new OohSession(store, clock);
    var userId = UUID.randomUUID();
    var supplierId = UUID.randomUUID();

    session.start(
        new LoginResponse(
            userId,
            "supplier",
            "Supplier Admin",
            "s@jcdecaux.co.za",
            Role.SUPPLIER_ADMIN,
            supplierId,
            true,
            Set.of(Capability.VIEW_INVENTORY),
            "jwt",
            NOW.plusSeconds(3600)));

    assertThat(store.load()).hasValueSatisfying(s -> assertThat(s.userId()).isEqualTo(userId));
    assertThat(session.current().map(StoredSession::supplierId)).contains(supplierId);

    session.clear();

    assertThat(session.isSignedIn()).isFalse();
    assertThat(store.load()).isEmpty();
  }
}
