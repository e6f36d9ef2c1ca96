package za.gov.ooh.oohbooking.document;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface DocumentRepository extends JpaRepository<Document, UUID> {

  @Query(
      """
      SELECT d FROM Document d
      WHERE (:campaignId IS NULL OR d.campaignId = :campaignId)
        AND (:bookingId IS NULL OR d.bookingId = :bookingId)
        AND (:type IS NULL OR d.type = :type)
        AND (:status IS NULL OR d.status = :status)
      ORDER BY d.uploadedAt DESC
      """)
  List<Document> findByFilters(
      @Param("campaignId") UUID campaignId,
      @Param("bookingId") UUID bookingId,
      @Param("type") DocumentType type,
      @Param("status") DocumentStatus status);
}
