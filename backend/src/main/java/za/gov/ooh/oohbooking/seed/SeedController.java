package za.gov.ooh.oohbooking.seed;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

/** Demo fixture loader. Unauthenticated; not registered at all when seeding is disabled. */
@RestController
@ConditionalOnProperty(
    prefix = "ooh.seed",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = true)
public class SeedController {

  private final SeedService seedService;

  public SeedController(SeedService seedService) {
    this.seedService = seedService;
  }

  @PostMapping("/api/seed")
  public ResponseEntity<SeedService.SeedResult> seed() {
    return ResponseEntity.ok(seedService.seed());
  }
}
