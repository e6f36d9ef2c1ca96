package za.gov.ooh.oohbooking.supplier;

import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import za.gov.ooh.oohbooking.exception.InvalidRequestException;
import za.gov.ooh.oohbooking.exception.ResourceNotFoundException;
import za.gov.ooh.oohbooking.supplier.dto.CreateSupplierRequest;
import za.gov.ooh.oohbooking.supplier.dto.UpdateSupplierRequest;

@Service
public class SupplierService {

  private static final Logger log = LoggerFactory.getLogger(SupplierService.class);

  private final SupplierRepository supplierRepository;

  public SupplierService(SupplierRepository supplierRepository) {
    this.supplierRepository = supplierRepository;
  }

  @Transactional(readOnly = true)
  public List<Supplier> listSuppliers(Boolean active) {
    return supplierRepository.findByFilters(active);
  }

  @Transactional(readOnly = true)
  public Supplier getSupplier(UUID id) {
    return supplierRepository
        .findById(id)
        .orElseThrow(() -> new ResourceNotFoundException("Supplier", id));
  }

  /**
   * Rejects a reference to a supplier that does not exist. Other modules call this before storing a
   * {@code supplierId}; there are no database foreign keys.
   *
   * @param field the request field reported in the 400 response
   */
  @Transactional(readOnly = true)
  public void requireExists(String field, UUID supplierId) {
    if (!supplierRepository.existsById(supplierId)) {
      throw new InvalidRequestException(field, "supplier " + supplierId + " does not exist");
    }
  }

  @Transactional
  public Supplier createSupplier(CreateSupplierRequest request) {
    var supplier =
        supplierRepository.save(
            new Supplier(
                request.name().trim(),
                request.contactPerson().trim(),
                request.email(),
                request.phone(),
                request.address()));
    log.info("Created supplier {} ({})", supplier.getId(), supplier.getName());
    return supplier;
  }

  @Transactional
  public Supplier updateSupplier(UUID id, UpdateSupplierRequest request) {
    var supplier = getSupplier(id);
    supplier.updateDetails(
        request.name() != null ? request.name().trim() : supplier.getName(),
        request.contactPerson() != null
            ? request.contactPerson().trim()
            : supplier.getContactPerson(),
        request.email() != null ? request.email() : supplier.getEmail(),
        request.phone() != null ? request.phone() : supplier.getPhone(),
        request.address() != null ? request.address() : supplier.getAddress());

    if (request.active() != null && request.active() != supplier.isActive()) {
      if (request.active()) {
        supplier.activate();
        log.info("Activated supplier {}", id);
      } else {
        supplier.deactivate();
        log.info("Deactivated supplier {}", id);
      }
    }
    return supplierRepository.save(supplier);
  }
}
