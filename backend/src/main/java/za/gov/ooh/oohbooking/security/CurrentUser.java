package za.gov.ooh.oohbooking.security;

import java.util.UUID;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

/** Static access to the caller bound by {@link UserIdentityFilter}. */
public final class CurrentUser {

  /** Returns the authenticated caller. Throws if the request was not authenticated. */
  public static AuthenticatedUser require() {
    AuthenticatedUser user = getOrNull();
    if (user == null) {
      throw new UserContextNotBoundException();
    }
    return user;
  }

  /** Returns the caller's user id. Throws if the request was not authenticated. */
  public static UUID requireId() {
    return require().id();
  }

  /** Returns the authenticated caller, or null outside an authenticated request. */
  public static AuthenticatedUser getOrNull() {
    Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
    if (authentication instanceof UserAuthentication userAuthentication) {
      return userAuthentication.getPrincipal();
    }
    return null;
  }

  private CurrentUser() {}
}
