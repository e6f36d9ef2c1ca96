package za.gov.ooh.oohbooking.supplier.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/** Partial update. Null fields are left unchanged; {@code active} toggles the supplier. */
public record UpdateSupplierRequest(
    @Pattern(regexp = ".*\\S.*", message = "name must not be blank") @Size(max = 255) String name,
    @Pattern(regexp = ".*\\S.*", message = "contactPerson must not be blank") @Size(max = 255)
        String contactPerson,
    @Email @Size(max = 255) String email,
    @Size(max = 50) String phone,
    @Size(max = 1000) String address,
    Boolean active) {}
