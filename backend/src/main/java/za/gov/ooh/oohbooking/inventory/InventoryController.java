package za.gov.ooh.oohbooking.inventory;

import jakarta.validation.Valid;
import java.net.URI;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import za.gov.ooh.oohbooking.inventory.dto.CreateInventoryItemRequest;
import za.gov.ooh.oohbooking.inventory.dto.InventoryItemResponse;
import za.gov.ooh.oohbooking.inventory.dto.UpdateInventoryItemRequest;
import za.gov.ooh.oohbooking.security.CurrentUser;

@RestController
@RequestMapping("/api/inventory")
public class InventoryController {

  private final InventoryService inventoryService;

  public InventoryController(InventoryService inventoryService) {
    this.inventoryService = inventoryService;
  }

  @GetMapping
  public ResponseEntity<List<InventoryItemResponse>> listItems(
      @RequestParam(required = false) UUID supplierId,
      @RequestParam(required = false) String region,
      @RequestParam(required = false) InventoryStatus status,
      @RequestParam(required = false) String screenType) {
    var items =
        inventoryService
            .listItems(CurrentUser.require(), supplierId, region, status, screenType)
            .stream()
            .map(InventoryItemResponse::from)
            .toList();
    return ResponseEntity.ok(items);
  }

  @GetMapping("/{id}")
  public ResponseEntity<InventoryItemResponse> getItem(@PathVariable UUID id) {
    return ResponseEntity.ok(
        InventoryItemResponse.from(inventoryService.getItem(CurrentUser.require(), id)));
  }

  @PostMapping
  public ResponseEntity<InventoryItemResponse> createItem(
      @Valid @RequestBody CreateInventoryItemRequest request) {
    var item = inventoryService.createItem(CurrentUser.require(), request);
    return ResponseEntity.created(URI.create("/api/inventory/" + item.getId()))
        .body(InventoryItemResponse.from(item));
  }

  @PatchMapping("/{id}")
  public ResponseEntity<InventoryItemResponse> updateItem(
      @PathVariable UUID id, @Valid @RequestBody UpdateInventoryItemRequest request) {
    return ResponseEntity.ok(
        InventoryItemResponse.from(
            inventoryService.updateItem(CurrentUser.require(), id, request)));
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<Void> deleteItem(@PathVariable UUID id) {
    inventoryService.deleteItem(CurrentUser.require(), id);
    return ResponseEntity.noContent().build();
  }
}
