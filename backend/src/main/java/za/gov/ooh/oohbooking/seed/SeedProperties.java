package za.gov.ooh.oohbooking.seed;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Demo data loading.
 *
 * @param enabled whether {@code POST /api/seed} is exposed
 * @param demoPassword password given to every seeded user
 * @param dataLocation resource holding the demo data set
 */
@ConfigurationProperties(prefix = "ooh.seed")
public record SeedProperties(
    @DefaultValue("true") boolean enabled,
    @DefaultValue("password123") String demoPassword,
    @DefaultValue("classpath:seed/demo-data.json") String dataLocation) {}
