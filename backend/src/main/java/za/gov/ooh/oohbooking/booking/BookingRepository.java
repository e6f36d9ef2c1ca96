package za.gov.ooh.oohbooking.booking;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface BookingRepository extends JpaRepository<Booking, UUID> {

  @Query(
      """
      SELECT b FROM Booking b
      WHERE (:campaignId IS NULL OR b.campaignId = :campaignId)
        AND (:supplierId IS NULL OR b.supplierId = :supplierId)
        AND (:status IS NULL OR b.status = :status)
      ORDER BY b.createdAt DESC
      """)
  List<Booking> findByFilters(
      @Param("campaignId") UUID campaignId,
      @Param("supplierId") UUID supplierId,
      @Param("status") BookingStatus status);

  long countByStatus(BookingStatus status);

  /** Exact sum of all booking costs; null when no booking carries a cost. */
  @Query("SELECT SUM(b.cost) FROM Booking b")
  BigDecimal sumCost();
}
