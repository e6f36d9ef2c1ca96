package za.gov.ooh.oohbooking.user;

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
import za.gov.ooh.oohbooking.security.Role;
import za.gov.ooh.oohbooking.user.dto.CreateUserRequest;
import za.gov.ooh.oohbooking.user.dto.UpdateUserRequest;
import za.gov.ooh.oohbooking.user.dto.UserResponse;

@RestController
@RequestMapping("/api/users")
public class UserController {

  private final UserService userService;

  public UserController(UserService userService) {
    this.userService = userService;
  }

  @GetMapping
  public ResponseEntity<List<UserResponse>> listUsers(
      @RequestParam(required = false) Role role,
      @RequestParam(required = false) UUID supplierId,
      @RequestParam(required = false) Boolean active) {
    var users =
        userService.listUsers(role, supplierId, active).stream().map(UserResponse::from).toList();
    return ResponseEntity.ok(users);
  }

  @GetMapping("/{id}")
  public ResponseEntity<UserResponse> getUser(@PathVariable UUID id) {
    return ResponseEntity.ok(UserResponse.from(userService.getUser(id)));
  }

  @PostMapping
  public ResponseEntity<UserResponse> createUser(@Valid @RequestBody CreateUserRequest request) {
    var user = userService.createUser(request);
    return ResponseEntity.created(URI.create("/api/users/" + user.getId()))
        .body(UserResponse.from(user));
  }

  @PatchMapping("/{id}")
  public ResponseEntity<UserResponse> updateUser(
      @PathVariable UUID id, @Valid @RequestBody UpdateUserRequest request) {
    return ResponseEntity.ok(UserResponse.from(userService.updateUser(id, request)));
  }
}
