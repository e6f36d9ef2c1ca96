package za.gov.ooh.oohbooking.security;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Identity settings.
 *
 * @param sessionSecret HS256 signing secret for session tokens, at least 32 bytes
 * @param sessionTtl lifetime of an issued session token
 * @param legacyUserIdHeader whether the unsigned {@code user-id} header is accepted as identity
 * @param identityCacheTtl how long a resolved caller is reused before re-reading the user row
 */
@ConfigurationProperties(prefix = "ooh.security")
public record SecurityProperties(
    String sessionSecret,
    @DefaultValue("8h") Duration sessionTtl,
    @DefaultValue("false") boolean legacyUserIdHeader,
    @DefaultValue("30s") Duration identityCacheTtl) {}
