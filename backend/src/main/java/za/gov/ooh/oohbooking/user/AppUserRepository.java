package za.gov.ooh.oohbooking.user;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import za.gov.ooh.oohbooking.security.Role;

public interface AppUserRepository extends JpaRepository<AppUser, UUID> {

  Optional<AppUser> findByUsername(String username);

  boolean existsByUsername(String username);

  @Query(
      """
      SELECT u FROM AppUser u
      WHERE (:role IS NULL OR u.role = :role)
        AND (:supplierId IS NULL OR u.supplierId = :supplierId)
        AND (:active IS NULL OR u.active = :active)
      ORDER BY u.createdAt DESC
      """)
  List<AppUser> findByFilters(
      @Param("role") Role role,
      @Param("supplierId") UUID supplierId,
      @Param("active") Boolean active);
}
