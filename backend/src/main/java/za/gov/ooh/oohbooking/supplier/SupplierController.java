package za.gov.ooh.oohbooking.supplier;

import jakarta.validation.Valid;
import java.net.URI;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import za.gov.ooh.oohbooking.supplier.dto.CreateSupplierRequest;
import za.gov.ooh.oohbooking.supplier.dto.SupplierResponse;
import za.gov.ooh.oohbooking.supplier.dto.UpdateSupplierRequest;

@RestController
@RequestMapping("/api/suppliers")
public class SupplierController {

  private final SupplierService supplierService;

  public SupplierController(SupplierService supplierService) {
    this.supplierService = supplierService;
  }

  @GetMapping
  public ResponseEntity<List<SupplierResponse>> listSuppliers(
      @RequestParam(required = false) Boolean active) {
    var suppliers =
        supplierService.listSuppliers(active).stream().map(SupplierResponse::from).toList();
    return ResponseEntity.ok(suppliers);
  }

  @GetMapping("/{id}")
  public ResponseEntity<SupplierResponse> getSupplier(@PathVariable UUID id) {
    return ResponseEntity.ok(SupplierResponse.from(supplierService.getSupplier(id)));
  }

  @PostMapping
  public ResponseEntity<SupplierResponse> createSupplier(
      @Valid @RequestBody CreateSupplierRequest request) {
    var supplier = supplierService.createSupplier(request);
    return ResponseEntity.created(URI.create("/api/suppliers/" + supplier.getId()))
        .body(SupplierResponse.from(supplier));
  }

  @PatchMapping("/{id}")
  public ResponseEntity<SupplierResponse> updateSupplier(
      @PathVariable UUID id, @Valid @RequestBody UpdateSupplierRequest request) {
    return ResponseEntity.ok(SupplierResponse.from(supplierService.updateSupplier(id, request)));
  }
}
