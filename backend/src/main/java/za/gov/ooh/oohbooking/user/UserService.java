package za.gov.ooh.oohbooking.user;

import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import za.gov.ooh.oohbooking.exception.AuthenticationFailedException;
import za.gov.ooh.oohbooking.exception.ResourceConflictException;
import za.gov.ooh.oohbooking.exception.ResourceNotFoundException;
import za.gov.ooh.oohbooking.security.Role;
import za.gov.ooh.oohbooking.security.UserIdentityResolver;
import za.gov.ooh.oohbooking.supplier.SupplierService;
import za.gov.ooh.oohbooking.user.dto.CreateUserRequest;
import za.gov.ooh.oohbooking.user.dto.UpdateUserRequest;

@Service
public class UserService {

  private static final Logger log = LoggerFactory.getLogger(UserService.class);

  private final AppUserRepository userRepository;
  private final SupplierService supplierService;
  private final PasswordEncoder passwordEncoder;
  private final UserIdentityResolver identityResolver;

  public UserService(
      AppUserRepository userRepository,
      SupplierService supplierService,
      PasswordEncoder passwordEncoder,
      UserIdentityResolver identityResolver) {
    this.userRepository = userRepository;
    this.supplierService = supplierService;
    this.passwordEncoder = passwordEncoder;
    this.identityResolver = identityResolver;
  }

  /**
   * Checks a username and password pair.
   *
   * @throws AuthenticationFailedException for an unknown user, an inactive user or a wrong
   *     password; the detail does not say which
   */
  @Transactional(readOnly = true)
  public AppUser authenticate(String username, String password) {
    var user = userRepository.findByUsername(username.trim()).orElse(null);
    if (user == null
        || !user.isActive()
        || !passwordEncoder.matches(password, user.getPasswordHash())) {
      log.warn("Failed login for username '{}'", username);
      throw new AuthenticationFailedException("Invalid credentials");
    }
    log.info("User {} logged in", user.getId());
    return user;
  }

  @Transactional(readOnly = true)
  public List<AppUser> listUsers(Role role, UUID supplierId, Boolean active) {
    return userRepository.findByFilters(role, supplierId, active);
  }

  @Transactional(readOnly = true)
  public AppUser getUser(UUID id) {
    return userRepository.findById(id).orElseThrow(() -> new ResourceNotFoundException("User", id));
  }

  @Transactional
  public AppUser createUser(CreateUserRequest request) {
    String username = request.username().trim();
    if (userRepository.existsByUsername(username)) {
      throw new ResourceConflictException(
          "Duplicate username", "A user with username '" + username + "' already exists");
    }
    if (request.supplierId() != null) {
      supplierService.requireExists("supplierId", request.supplierId());
    }

    var user =
        userRepository.save(
            new AppUser(
                username,
                passwordEncoder.encode(request.password()),
                request.fullName().trim(),
                request.email(),
                request.role(),
                request.supplierId()));
    log.info("Created user {} ({}) with role {}", user.getId(), username, user.getRole());
    return user;
  }

  @Transactional
  public AppUser updateUser(UUID id, UpdateUserRequest request) {
    var user = getUser(id);

    if (request.fullName() != null || request.email() != null) {
      user.updateProfile(
          request.fullName() != null ? request.fullName().trim() : user.getFullName(),
          request.email() != null ? request.email() : user.getEmail());
    }

    if (request.role() != null || request.supplierId() != null) {
      if (request.supplierId() != null) {
        supplierService.requireExists("supplierId", request.supplierId());
      }
      user.changeRole(
          request.role() != null ? request.role() : user.getRole(),
          request.supplierId() != null ? request.supplierId() : user.getSupplierId());
    }

    if (request.password() != null) {
      user.changePasswordHash(passwordEncoder.encode(request.password()));
      log.info("Reset password for user {}", id);
    }

    if (request.active() != null && request.active() != user.isActive()) {
      if (request.active()) {
        user.activate();
        log.info("Activated user {}", id);
      } else {
        user.deactivate();
        log.info("Deactivated user {}", id);
      }
    }

    user = userRepository.save(user);
    identityResolver.evict(id);
    return user;
  }
}
