package za.gov.ooh.oohbooking.security;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.JWSSigner;
import com.nimbusds.jose.JWSVerifier;
import com.nimbusds.jose.crypto.MACSigner;
import com.nimbusds.jose.crypto.MACVerifier;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import java.nio.charset.StandardCharsets;
import java.text.ParseException;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import za.gov.ooh.oohbooking.exception.AuthenticationFailedException;

/**
 * Issues and verifies HS256 session tokens handed out at login. The subject is the user id; role and
 * supplier affiliation are always re-read from the user row so deactivation takes effect without
 * waiting for expiry.
 */
@Service
public class SessionTokenService {

  private static final Logger log = LoggerFactory.getLogger(SessionTokenService.class);
  private static final String TOKEN_TYPE = "session";
  private static final int MIN_SECRET_BYTES = 32;

  private final byte[] secret;
  private final Duration ttl;

  public SessionTokenService(SecurityProperties properties) {
    if (properties.sessionSecret() == null
        || properties.sessionSecret().getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES) {
      throw new IllegalStateException(
          "ooh.security.session-secret must be at least " + MIN_SECRET_BYTES + " bytes");
    }
    this.secret = properties.sessionSecret().getBytes(StandardCharsets.UTF_8);
    this.ttl = properties.sessionTtl();
  }

  public record SessionToken(String token, Instant expiresAt) {}

  public SessionToken issueToken(UUID userId) {
    try {
      Instant now = Instant.now();
      Instant expiresAt = now.plus(ttl);
      var claims =
          new JWTClaimsSet.Builder()
              .jwtID(UUID.randomUUID().toString())
              .subject(userId.toString())
              .claim("type", TOKEN_TYPE)
              .issueTime(Date.from(now))
              .expirationTime(Date.from(expiresAt))
              .build();

      var signedJwt = new SignedJWT(new JWSHeader(JWSAlgorithm.HS256), claims);
      JWSSigner signer = new MACSigner(secret);
      signedJwt.sign(signer);

      log.debug("Issued session token for user {}", userId);
      return new SessionToken(signedJwt.serialize(), expiresAt);
    } catch (JOSEException e) {
      throw new IllegalStateException("Failed to sign session token", e);
    }
  }

  /**
   * Verifies signature, expiry and token type.
   *
   * @return the user id carried in the subject
   * @throws AuthenticationFailedException if the token cannot be trusted
   */
  public UUID verifyToken(String token) {
    try {
      var signedJwt = SignedJWT.parse(token);
      JWSVerifier verifier = new MACVerifier(secret);

      if (!signedJwt.verify(verifier)) {
        throw new AuthenticationFailedException("Invalid session token signature");
      }

      var claims = signedJwt.getJWTClaimsSet();
      if (claims.getExpirationTime() == null
          || claims.getExpirationTime().toInstant().isBefore(Instant.now())) {
        throw new AuthenticationFailedException("Session has expired");
      }
      if (!TOKEN_TYPE.equals(claims.getStringClaim("type"))) {
        throw new AuthenticationFailedException("Invalid token type");
      }

      return UUID.fromString(claims.getSubject());
    } catch (ParseException | JOSEException | IllegalArgumentException e) {
      throw new AuthenticationFailedException("Invalid session token: " + e.getMessage());
    }
  }
}
