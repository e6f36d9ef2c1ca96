package za.gov.ooh.oohbooking.dashboard;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import za.gov.ooh.oohbooking.dashboard.dto.DashboardStats;

@RestController
public class DashboardController {

  private final DashboardService dashboardService;

  public DashboardController(DashboardService dashboardService) {
    this.dashboardService = dashboardService;
  }

  /** Returns the headline counters shown to every role. */
  @GetMapping("/api/dashboard/stats")
  public ResponseEntity<DashboardStats> getStats() {
    return ResponseEntity.ok(dashboardService.getStats());
  }
}
