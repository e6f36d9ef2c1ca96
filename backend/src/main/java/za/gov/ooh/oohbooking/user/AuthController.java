package za.gov.ooh.oohbooking.user;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.time.Instant;
import java.util.Set;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import za.gov.ooh.oohbooking.security.Capability;
import za.gov.ooh.oohbooking.security.CurrentUser;
import za.gov.ooh.oohbooking.security.Role;
import za.gov.ooh.oohbooking.security.SessionTokenService;

@RestController
@RequestMapping("/api/auth")
public class AuthController {

  private final UserService userService;
  private final SessionTokenService sessionTokenService;

  public AuthController(UserService userService, SessionTokenService sessionTokenService) {
    this.userService = userService;
    this.sessionTokenService = sessionTokenService;
  }

  @PostMapping("/login")
  public ResponseEntity<LoginResponse> login(@Valid @RequestBody LoginRequest request) {
    var user = userService.authenticate(request.username(), request.password());
    var session = sessionTokenService.issueToken(user.getId());
    return ResponseEntity.ok(LoginResponse.from(user, session));
  }

  @GetMapping("/me")
  public ResponseEntity<MeResponse> me() {
    var user = userService.getUser(CurrentUser.requireId());
    return ResponseEntity.ok(MeResponse.from(user));
  }

  // --- DTOs ---

  public record LoginRequest(
      @NotBlank(message = "username is required") String username,
      @NotBlank(message = "password is required") String password) {}

  public record LoginResponse(
      UUID id,
      String username,
      String fullName,
      String email,
      Role role,
      UUID supplierId,
      boolean active,
      Set<Capability> capabilities,
      String token,
      Instant expiresAt) {

    public static LoginResponse from(AppUser user, SessionTokenService.SessionToken session) {
      return new LoginResponse(
          user.getId(),
          user.getUsername(),
          user.getFullName(),
          user.getEmail(),
          user.getRole(),
          user.getSupplierId(),
          user.isActive(),
          user.getRole().capabilities(),
          session.token(),
          session.expiresAt());
    }
  }

  public record MeResponse(
      UUID id,
      String username,
      String fullName,
      String email,
      Role role,
      UUID supplierId,
      boolean active,
      Instant createdAt,
      Set<Capability> capabilities) {

    public static MeResponse from(AppUser user) {
      return new MeResponse(
          user.getId(),
          user.getUsername(),
          user.getFullName(),
          user.getEmail(),
          user.getRole(),
          user.getSupplierId(),
          user.isActive(),
          user.getCreatedAt(),
          user.getRole().capabilities());
    }
  }
}
