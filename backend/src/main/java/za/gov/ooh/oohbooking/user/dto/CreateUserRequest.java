package za.gov.ooh.oohbooking.user.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.util.UUID;
import za.gov.ooh.oohbooking.security.Role;

/** {@code role} defaults to {@code campaign_planner} when absent. */
public record CreateUserRequest(
    @NotBlank(message = "username is required") @Size(max = 100) String username,
    @NotBlank(message = "password is required") @Size(max = 72) String password,
    @NotBlank(message = "fullName is required") @Size(max = 255) String fullName,
    @NotBlank(message = "email is required") @Email @Size(max = 255) String email,
    Role role,
    UUID supplierId) {}
