package za.gov.ooh.oohbooking.supplier.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateSupplierRequest(
    @NotBlank(message = "name is required") @Size(max = 255) String name,
    @NotBlank(message = "contactPerson is required") @Size(max = 255) String contactPerson,
    @NotBlank(message = "email is required") @Email @Size(max = 255) String email,
    @Size(max = 50) String phone,
    @Size(max = 1000) String address) {}
