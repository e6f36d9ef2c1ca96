package za.gov.ooh.oohbooking.dashboard.dto;

/**
 * Headline counters for the dashboard.
 *
 * @param activeCampaigns campaigns with status {@code in_progress}
 * @param totalSpend exact sum of booking costs as a decimal string; {@code "0"} when none
 */
public record DashboardStats(
    long totalCampaigns,
    long activeCampaigns,
    long totalBookings,
    String totalSpend,
    long pendingBookings,
    long completedBookings) {}
