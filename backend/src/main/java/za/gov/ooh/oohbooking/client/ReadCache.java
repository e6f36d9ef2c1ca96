package za.gov.ooh.oohbooking.client;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Duration;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Client-side cache of GET responses. Reads whose result depends on who is asking carry the
 * caller's user id in their key, so a new session can never be served another user's rows.
 */
class ReadCache {

  /**
   * @param resource the resource family, used for invalidation after mutations
   * @param uri the request path including its query string
   * @param userId the caller, for identity-sensitive reads; null otherwise
   */
  record Key(String resource, String uri, UUID userId) {}

  private final Cache<Key, Object> cache;

  ReadCache(Duration ttl) {
    this.cache = Caffeine.newBuilder().maximumSize(1_000).expireAfterWrite(ttl).build();
  }

  @SuppressWarnings("unchecked")
  <T> T get(Key key, Supplier<T> loader) {
    return (T) cache.get(key, k -> loader.get());
  }

  void invalidate(Set<String> resources) {
    cache.asMap().keySet().removeIf(key -> resources.contains(key.resource()));
  }

  void invalidateAll() {
    cache.invalidateAll();
  }

  long size() {
    cache.cleanUp();
    return cache.estimatedSize();
  }
}
