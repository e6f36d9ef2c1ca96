package za.gov.ooh.oohbooking.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;
import za.gov.ooh.oohbooking.exception.AuthenticationFailedException;

/**
 * Establishes the caller's identity from a {@code Bearer} session token or, when enabled, the
 * legacy {@code user-id} header. A request carrying no usable identity continues unauthenticated;
 * the security chain then answers 401 for protected paths.
 */
@Component
public class UserIdentityFilter extends OncePerRequestFilter {

  private static final Logger log = LoggerFactory.getLogger(UserIdentityFilter.class);

  static final String BEARER_PREFIX = "Bearer ";
  static final String LEGACY_USER_ID_HEADER = "user-id";

  private final SessionTokenService sessionTokenService;
  private final UserIdentityResolver identityResolver;
  private final boolean legacyHeaderEnabled;

  public UserIdentityFilter(
      SessionTokenService sessionTokenService,
      UserIdentityResolver identityResolver,
      SecurityProperties properties) {
    this.sessionTokenService = sessionTokenService;
    this.identityResolver = identityResolver;
    this.legacyHeaderEnabled = properties.legacyUserIdHeader();
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {

    UUID userId = extractUserId(request);
    if (userId != null) {
      identityResolver
          .resolve(userId)
          .ifPresentOrElse(
              user ->
                  SecurityContextHolder.getContext().setAuthentication(new UserAuthentication(user)),
              () -> log.debug("Ignoring identity for unknown or inactive user {}", userId));
    }

    filterChain.doFilter(request, response);
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    return request.getRequestURI().startsWith("/actuator/");
  }

  private UUID extractUserId(HttpServletRequest request) {
    String authHeader = request.getHeader("Authorization");
    if (authHeader != null && authHeader.startsWith(BEARER_PREFIX)) {
      try {
        return sessionTokenService.verifyToken(authHeader.substring(BEARER_PREFIX.length()));
      } catch (AuthenticationFailedException e) {
        log.debug("Rejected session token: {}", e.getBody().getDetail());
        return null;
      }
    }

    if (legacyHeaderEnabled) {
      String headerValue = request.getHeader(LEGACY_USER_ID_HEADER);
      if (headerValue != null && !headerValue.isBlank()) {
        try {
          return UUID.fromString(headerValue.trim());
        } catch (IllegalArgumentException e) {
          log.debug("Malformed {} header: {}", LEGACY_USER_ID_HEADER, headerValue);
        }
      }
    }
    return null;
  }
}
