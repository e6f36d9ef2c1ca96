package za.gov.ooh.oohbooking.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import za.gov.ooh.oohbooking.exception.AuthenticationFailedException;

class SessionTokenServiceTest {

  private static final String SECRET = "unit-test-session-secret-at-least-32-bytes";

  private final SessionTokenService service =
      new SessionTokenService(
          new SecurityProperties(SECRET, Duration.ofHours(1), false, Duration.ofSeconds(30)));

  @Test
  void issuedTokenVerifiesToTheSameUser() {
    var userId = UUID.randomUUID();

    var session = service.issueToken(userId);

    assertThat(service.verifyToken(session.token())).isEqualTo(userId);
    assertThat(session.expiresAt()).isAfter(Instant.now().plus(Duration.ofMinutes(59)));
  }

  @Test
  void tokenSignedWithAnotherSecretIsRejected() {
    var other =
        new SessionTokenService(
            new SecurityProperties(
                "another-secret-that-is-also-32-bytes-long",
                Duration.ofHours(1),
                false,
                Duration.ofSeconds(30)));
    var token = other.issueToken(UUID.randomUUID()).token();

    assertThatThrownBy(() -> service.verifyToken(token))
        .isInstanceOf(AuthenticationFailedException.class);
  }

  @Test
  void expiredTokenIsRejected() {
    var shortLived =
        new SessionTokenService(
            new SecurityProperties(SECRET, Duration.ofSeconds(-5), false, Duration.ofSeconds(30)));
    var token = shortLived.issueToken(UUID.randomUUID()).token();

    assertThatThrownBy(() -> service.verifyToken(token))
        .isInstanceOf(AuthenticationFailedException.class);
  }

  @Test
  void garbageIsRejected() {
    assertThatThrownBy(() -> service.verifyToken("not-a-jwt"))
        .isInstanceOf(AuthenticationFailedException.class);
  }

  @Test
  void shortSecretFailsAtStartup() {
    assertThatThrownBy(
            () ->
                new SessionTokenService(
                    new SecurityProperties(
                        "too-short", Duration.ofHours(1), false, Duration.ofSeconds(30))))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("session-secret");
  }
}
