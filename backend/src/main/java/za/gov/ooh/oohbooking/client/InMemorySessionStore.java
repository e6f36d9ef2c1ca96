package za.gov.ooh.oohbooking.client;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

public class InMemorySessionStore implements SessionStore {

  private final AtomicReference<StoredSession> stored = new AtomicReference<>();

  @Override
  public Optional<StoredSession> load() {
    return Optional.ofNullable(stored.get());
  }

  @Override
  public void save(StoredSession session) {
    stored.set(session);
  }

  @Override
  public void clear() {
    stored.set(null);
  }
}
