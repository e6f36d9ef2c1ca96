package za.gov.ooh.oohbooking.dashboard;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import za.gov.ooh.oohbooking.booking.BookingRepository;
import za.gov.ooh.oohbooking.booking.BookingStatus;
import za.gov.ooh.oohbooking.campaign.CampaignRepository;
import za.gov.ooh.oohbooking.campaign.CampaignStatus;
import za.gov.ooh.oohbooking.common.Amounts;
import za.gov.ooh.oohbooking.dashboard.dto.DashboardStats;

/** Computes dashboard counters directly from the current rows on every call. */
@Service
public class DashboardService {

  private static final Logger log = LoggerFactory.getLogger(DashboardService.class);

  private final CampaignRepository campaignRepository;
  private final BookingRepository bookingRepository;

  public DashboardService(
      CampaignRepository campaignRepository, BookingRepository bookingRepository) {
    this.campaignRepository = campaignRepository;
    this.bookingRepository = bookingRepository;
  }

  @Transactional(readOnly = true)
  public DashboardStats getStats() {
    var stats =
        new DashboardStats(
            campaignRepository.count(),
            campaignRepository.countByStatus(CampaignStatus.IN_PROGRESS),
            bookingRepository.count(),
            Amounts.formatOrZero(bookingRepository.sumCost()),
            bookingRepository.countByStatus(BookingStatus.PENDING),
            bookingRepository.countByStatus(BookingStatus.COMPLETED));
    log.debug("Computed dashboard stats: {}", stats);
    return stats;
  }
}
