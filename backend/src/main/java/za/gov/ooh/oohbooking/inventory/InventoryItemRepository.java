package za.gov.ooh.oohbooking.inventory;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface InventoryItemRepository extends JpaRepository<InventoryItem, UUID> {

  @Query(
      """
      SELECT i FROM InventoryItem i
      WHERE (:supplierId IS NULL OR i.supplierId = :supplierId)
        AND (:region IS NULL OR i.region = :region)
        AND (:status IS NULL OR i.status = :status)
        AND (:screenType IS NULL OR i.screenType = :screenType)
      ORDER BY i.screenName ASC
      """)
  List<InventoryItem> findByFilters(
      @Param("supplierId") UUID supplierId,
      @Param("region") String region,
      @Param("status") InventoryStatus status,
      @Param("screenType") String screenType);
}
