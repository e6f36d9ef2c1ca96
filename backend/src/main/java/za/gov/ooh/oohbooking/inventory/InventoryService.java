package za.gov.ooh.oohbooking.inventory;

import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import za.gov.ooh.oohbooking.exception.InvalidRequestException;
import za.gov.ooh.oohbooking.exception.ResourceNotFoundException;
import za.gov.ooh.oohbooking.inventory.dto.CreateInventoryItemRequest;
import za.gov.ooh.oohbooking.inventory.dto.UpdateInventoryItemRequest;
import za.gov.ooh.oohbooking.security.AuthenticatedUser;
import za.gov.ooh.oohbooking.supplier.SupplierService;

/**
 * Inventory reads and writes, always evaluated against the caller's scope. Items outside the scope
 * are reported as not found.
 */
@Service
public class InventoryService {

  private static final Logger log = LoggerFactory.getLogger(InventoryService.class);

  private final InventoryItemRepository inventoryItemRepository;
  private final InventoryAccessPolicy accessPolicy;
  private final SupplierService supplierService;

  public InventoryService(
      InventoryItemRepository inventoryItemRepository,
      InventoryAccessPolicy accessPolicy,
      SupplierService supplierService) {
    this.inventoryItemRepository = inventoryItemRepository;
    this.accessPolicy = accessPolicy;
    this.supplierService = supplierService;
  }

  @Transactional(readOnly = true)
  public List<InventoryItem> listItems(
      AuthenticatedUser caller,
      UUID supplierId,
      String region,
      InventoryStatus status,
      String screenType) {
    var scope = accessPolicy.scopeListing(caller, supplierId);
    if (scope.matchesNothing()) {
      log.debug("Inventory listing for user {} is out of scope, returning no items", caller.id());
      return List.of();
    }
    return inventoryItemRepository.findByFilters(scope.supplierId(), region, status, screenType);
  }

  @Transactional(readOnly = true)
  public InventoryItem getItem(AuthenticatedUser caller, UUID id) {
    var item =
        inventoryItemRepository
            .findById(id)
            .orElseThrow(() -> new ResourceNotFoundException("Inventory item", id));
    if (!accessPolicy.canAccess(caller, item)) {
      throw new ResourceNotFoundException("Inventory item", id);
    }
    return item;
  }

  /**
   * Rejects a reference to an inventory item that does not exist or that belongs to a different
   * supplier than the one given.
   */
  @Transactional(readOnly = true)
  public void requireBookable(String field, UUID inventoryItemId, UUID supplierId) {
    var item =
        inventoryItemRepository
            .findById(inventoryItemId)
            .orElseThrow(
                () ->
                    new InvalidRequestException(
                        field, "inventory item " + inventoryItemId + " does not exist"));
    if (!item.getSupplierId().equals(supplierId)) {
      throw new InvalidRequestException(
          field, "inventory item " + inventoryItemId + " belongs to a different supplier");
    }
  }

  @Transactional
  public InventoryItem createItem(AuthenticatedUser caller, CreateInventoryItemRequest request) {
    UUID supplierId = accessPolicy.resolveOwningSupplier(caller, request.supplierId());
    if (supplierId == null) {
      throw new InvalidRequestException("supplierId", "supplierId is required");
    }
    supplierService.requireExists("supplierId", supplierId);

    var item =
        new InventoryItem(
            supplierId,
            request.screenName().trim(),
            request.screenType().trim(),
            request.location().trim(),
            request.region().trim(),
            request.dailyRate());
    item.locate(request.gpsLatitude(), request.gpsLongitude(), request.facing());
    item.specify(
        request.dimensions(),
        request.resolution(),
        Boolean.TRUE.equals(request.illuminated()),
        Boolean.TRUE.equals(request.digital()),
        request.trafficCount());
    item.price(request.dailyRate(), request.weeklyRate(), request.monthlyRate());
    item.changeAvailability(
        request.status() != null ? request.status() : InventoryStatus.AVAILABLE,
        request.availableFrom(),
        request.availableTo());
    item.updateNotes(request.notes());

    item = inventoryItemRepository.save(item);
    log.info(
        "Created inventory item {} ({}) for supplier {}",
        item.getId(),
        item.getScreenName(),
        supplierId);
    return item;
  }

  @Transactional
  public InventoryItem updateItem(
      AuthenticatedUser caller, UUID id, UpdateInventoryItemRequest request) {
    var item = getItem(caller, id);

    if (request.supplierId() != null) {
      UUID supplierId = accessPolicy.resolveOwningSupplier(caller, request.supplierId());
      if (!supplierId.equals(item.getSupplierId())) {
        supplierService.requireExists("supplierId", supplierId);
        log.info("Moving inventory item {} to supplier {}", id, supplierId);
        item.assignSupplier(supplierId);
      }
    }

    item.describe(
        request.screenName() != null ? request.screenName().trim() : item.getScreenName(),
        request.screenType() != null ? request.screenType().trim() : item.getScreenType(),
        request.location() != null ? request.location().trim() : item.getLocation(),
        request.region() != null ? request.region().trim() : item.getRegion());
    item.locate(
        request.gpsLatitude() != null ? request.gpsLatitude() : item.getGpsLatitude(),
        request.gpsLongitude() != null ? request.gpsLongitude() : item.getGpsLongitude(),
        request.facing() != null ? request.facing() : item.getFacing());
    item.specify(
        request.dimensions() != null ? request.dimensions() : item.getDimensions(),
        request.resolution() != null ? request.resolution() : item.getResolution(),
        request.illuminated() != null ? request.illuminated() : item.isIlluminated(),
        request.digital() != null ? request.digital() : item.isDigital(),
        request.trafficCount() != null ? request.trafficCount() : item.getTrafficCount());
    item.price(
        request.dailyRate() != null ? request.dailyRate() : item.getDailyRate(),
        request.weeklyRate() != null ? request.weeklyRate() : item.getWeeklyRate(),
        request.monthlyRate() != null ? request.monthlyRate() : item.getMonthlyRate());
    item.changeAvailability(
        request.status() != null ? request.status() : item.getStatus(),
        request.availableFrom() != null ? request.availableFrom() : item.getAvailableFrom(),
        request.availableTo() != null ? request.availableTo() : item.getAvailableTo());
    if (request.notes() != null) {
      item.updateNotes(request.notes());
    }
    if (request.active() != null) {
      if (request.active()) {
        item.activate();
      } else {
        item.deactivate();
      }
    }

    return inventoryItemRepository.save(item);
  }

  @Transactional
  public void deleteItem(AuthenticatedUser caller, UUID id) {
    var item = getItem(caller, id);
    inventoryItemRepository.delete(item);
    log.info("Deleted inventory item {}", id);
  }
}
