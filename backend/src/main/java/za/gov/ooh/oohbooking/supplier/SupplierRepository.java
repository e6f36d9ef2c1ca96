package za.gov.ooh.oohbooking.supplier;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface SupplierRepository extends JpaRepository<Supplier, UUID> {

  @Query(
      """
      SELECT s FROM Supplier s
      WHERE (:active IS NULL OR s.active = :active)
      ORDER BY s.createdAt DESC
      """)
  List<Supplier> findByFilters(@Param("active") Boolean active);
}
