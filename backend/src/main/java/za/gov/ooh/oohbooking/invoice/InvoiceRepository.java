package za.gov.ooh.oohbooking.invoice;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface InvoiceRepository extends JpaRepository<Invoice, UUID> {

  boolean existsByInvoiceNumber(String invoiceNumber);

  @Query(
      """
      SELECT i FROM Invoice i
      WHERE (:campaignId IS NULL OR i.campaignId = :campaignId)
        AND (:supplierId IS NULL OR i.supplierId = :supplierId)
        AND (:status IS NULL OR i.status = :status)
      ORDER BY i.createdAt DESC
      """)
  List<Invoice> findByFilters(
      @Param("campaignId") UUID campaignId,
      @Param("supplierId") UUID supplierId,
      @Param("status") InvoiceStatus status);
}
