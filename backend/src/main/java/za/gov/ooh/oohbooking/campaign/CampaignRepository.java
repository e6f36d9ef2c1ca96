package za.gov.ooh.oohbooking.campaign;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface CampaignRepository extends JpaRepository<Campaign, UUID> {

  @Query(
      """
      SELECT c FROM Campaign c
      WHERE (:status IS NULL OR c.status = :status)
        AND (:region IS NULL OR c.region = :region)
      ORDER BY c.createdAt DESC
      """)
  List<Campaign> findByFilters(
      @Param("status") CampaignStatus status, @Param("region") String region);

  long countByStatus(CampaignStatus status);
}
