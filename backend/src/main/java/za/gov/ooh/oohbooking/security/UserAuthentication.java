package za.gov.ooh.oohbooking.security;

import java.util.List;
import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;

/** Authentication installed by {@link UserIdentityFilter} once the caller's identity is known. */
public class UserAuthentication extends AbstractAuthenticationToken {

  private final AuthenticatedUser user;

  public UserAuthentication(AuthenticatedUser user) {
    super(List.of(new SimpleGrantedAuthority(user.role().authority())));
    this.user = user;
    setAuthenticated(true);
  }

  @Override
  public Object getCredentials() {
    return null;
  }

  @Override
  public AuthenticatedUser getPrincipal() {
    return user;
  }

  @Override
  public String getName() {
    return user.username();
  }
}
