package za.gov.ooh.oohbooking.user.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import java.util.UUID;
import za.gov.ooh.oohbooking.security.Role;

/**
 * Partial update. Null fields are left unchanged. A non-null {@code password} resets the password;
 * {@code active} toggles the account.
 */
public record UpdateUserRequest(
    @Pattern(regexp = ".*\\S.*", message = "fullName must not be blank") @Size(max = 255)
        String fullName,
    @Email @Size(max = 255) String email,
    Role role,
    UUID supplierId,
    @Pattern(regexp = ".*\\S.*", message = "password must not be blank") @Size(max = 72)
        String password,
    Boolean active) {}
