package za.gov.ooh.oohbooking.client;

import java.util.Optional;

/** Where a client persists its session between runs (browser storage, a file, memory). */
public interface SessionStore {

  Optional<StoredSession> load();

  void save(StoredSession session);

  void clear();
}
