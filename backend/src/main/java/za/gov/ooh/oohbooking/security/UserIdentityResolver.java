package za.gov.ooh.oohbooking.security;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import za.gov.ooh.oohbooking.user.AppUserRepository;

/**
 * Maps a user id to an {@link AuthenticatedUser}. Only active users resolve. Results are cached
 * briefly; {@link #evict} must be called whenever a user's role, affiliation or active flag changes.
 */
@Component
public class UserIdentityResolver {

  private static final Logger log = LoggerFactory.getLogger(UserIdentityResolver.class);

  private final AppUserRepository userRepository;
  private final Cache<UUID, AuthenticatedUser> identityCache;

  public UserIdentityResolver(AppUserRepository userRepository, SecurityProperties properties) {
    this.userRepository = userRepository;
    this.identityCache =
        Caffeine.newBuilder()
            .maximumSize(10_000)
            .expireAfterWrite(properties.identityCacheTtl())
            .build();
  }

  public Optional<AuthenticatedUser> resolve(UUID userId) {
    // A null from the loader leaves nothing cached, so unknown and inactive ids are re-checked
    return Optional.ofNullable(identityCache.get(userId, this::loadActiveUser));
  }

  public void evict(UUID userId) {
    identityCache.invalidate(userId);
  }

  private AuthenticatedUser loadActiveUser(UUID userId) {
    var user = userRepository.findById(userId).orElse(null);
    if (user == null) {
      log.debug("No user found for id {}", userId);
      return null;
    }
    if (!user.isActive()) {
      log.debug("User {} is inactive", userId);
      return null;
    }
    return new AuthenticatedUser(
        user.getId(), user.getUsername(), user.getRole(), user.getSupplierId());
  }
}
