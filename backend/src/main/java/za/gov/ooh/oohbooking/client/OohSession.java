package za.gov.ooh.oohbooking.client;

import java.time.Clock;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import za.gov.ooh.oohbooking.user.AuthController.LoginResponse;

/**
 * The signed-in identity of one client, backed by a {@link SessionStore}. Call {@link #load()} once
 * at startup to restore a persisted session; {@link #start} after a successful login; {@link
 * #clear()} on logout or when the server rejects the token.
 */
public class OohSession {

  private static final Logger log = LoggerFactory.getLogger(OohSession.class);

  private final SessionStore store;
  private final Clock clock;
  private volatile StoredSession current;

  public OohSession(SessionStore store) {
    this(store, Clock.systemUTC());
  }

  public OohSession(SessionStore store, Clock clock) {
    this.store = store;
    this.clock = clock;
  }

  /** Restores the persisted session. An expired session is discarded instead. */
  public Optional<StoredSession> load() {
    var restored = store.load().orElse(null);
    if (restored != null && restored.isExpired(clock.instant())) {
      log.debug("Discarding expired session for {}", restored.username());
      store.clear();
      restored = null;
    }
    current = restored;
    return Optional.ofNullable(restored);
  }

  public StoredSession start(LoginResponse login) {
    var session =
        new StoredSession(
            login.id(),
            login.username(),
            login.role(),
            login.supplierId(),
            login.token(),
            login.expiresAt());
    store.save(session);
    current = session;
    log.debug("Started session for {}", session.username());
    return session;
  }

  public void clear() {
    store.clear();
    current = null;
  }

  public Optional<StoredSession> current() {
    return Optional.ofNullable(current);
  }

  public boolean isSignedIn() {
    return current != null;
  }
}
