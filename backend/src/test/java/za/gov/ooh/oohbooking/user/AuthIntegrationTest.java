package za.gov.ooh.oohbooking.user;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;
import static za.gov.ooh.oohbooking.TestFixtures.PASSWORD;
import static za.gov.ooh.oohbooking.TestFixtures.USER_ID_HEADER;

import com.jayway.jsonpath.JsonPath;
import java.util.UUID;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.webmvc.test.autoconfigure.AutoConfigureMockMvc;
import org.springframework.http.MediaType;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import za.gov.ooh.oohbooking.TestFixtures;
import za.gov.ooh.oohbooking.security.Role;
import za.gov.ooh.oohbooking.supplier.SupplierRepository;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class AuthIntegrationTest {

  @Autowired private MockMvc mockMvc;
  @Autowired private AppUserRepository userRepository;
  @Autowired private SupplierRepository supplierRepository;
  @Autowired private PasswordEncoder passwordEncoder;

  private UUID adminId;
  private UUID supplierUserId;
  private UUID supplierId;

  @BeforeAll
  void createUsers() {
    supplierId = TestFixtures.createSupplier(supplierRepository, "authsupplier");
    adminId =
        TestFixtures.createUser(
            userRepository, passwordEncoder, "auth_admin", Role.DEPARTMENT_ADMIN, null);
    supplierUserId =
        TestFixtures.createUser(
            userRepository, passwordEncoder, "auth_supplier", Role.SUPPLIER_USER, supplierId);
  }

  private String login(String username) throws Exception {
    var result =
        mockMvc
            .perform(
                post("/api/auth/login")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(
                        """
                        {"username": "%s", "password": "%s"}
                        """
                            .formatted(username, PASSWORD)))
            .andExpect(status().isOk())
            .andReturn();
    return JsonPath.read(result.getResponse().getContentAsString(), "$.token");
  }

  @Test
  void loginReturnsProfileTokenAndCapabilitiesButNoPassword() throws Exception {
    mockMvc
        .perform(
            post("/api/auth/login")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"username": "auth_supplier", "password": "%s"}
                    """
                        .formatted(PASSWORD)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.id").value(supplierUserId.toString()))
        .andExpect(jsonPath("$.role").value("supplier_user"))
        .andExpect(jsonPath("$.supplierId").value(supplierId.toString()))
        .andExpect(jsonPath("$.token").isNotEmpty())
        .andExpect(jsonPath("$.expiresAt").exists())
        .andExpect(jsonPath("$.capabilities").isArray())
        .andExpect(jsonPath("$.password").doesNotExist())
        .andExpect(jsonPath("$.passwordHash").doesNotExist());
  }

  @Test
  void wrongPasswordIsRejected() throws Exception {
    mockMvc
        .perform(
            post("/api/auth/login")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"username": "auth_admin", "password": "nope"}
                    """))
        .andExpect(status().isUnauthorized())
        .andExpect(jsonPath("$.detail").value("Invalid credentials"));
  }

  @Test
  void unknownUsernameIsIndistinguishableFromWrongPassword() throws Exception {
    mockMvc
        .perform(
            post("/api/auth/login")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"username": "nobody_here", "password": "nope"}
                    """))
        .andExpect(status().isUnauthorized())
        .andExpect(jsonPath("$.detail").value("Invalid credentials"));
  }

  @Test
  void blankCredentialsAreAValidationError() throws Exception {
    mockMvc
        .perform(
            post("/api/auth/login")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"username": "", "password": ""}
                    """))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.errors").isArray());
  }

  @Test
  void protectedEndpointWithoutIdentityIs401() throws Exception {
    mockMvc
        .perform(get("/api/campaigns"))
        .andExpect(status().isUnauthorized())
        .andExpect(jsonPath("$.title").value("Authentication required"));
  }

  @Test
  void unknownUserIdHeaderIs401() throws Exception {
    mockMvc
        .perform(get("/api/campaigns").header(USER_ID_HEADER, UUID.randomUUID().toString()))
        .andExpect(status().isUnauthorized());
  }

  @Test
  void malformedUserIdHeaderIs401() throws Exception {
    mockMvc
        .perform(get("/api/campaigns").header(USER_ID_HEADER, "not-a-uuid"))
        .andExpect(status().isUnauthorized());
  }

  @Test
  void bearerTokenIdentifiesCaller() throws Exception {
    var token = login("auth_admin");

    mockMvc
        .perform(get("/api/auth/me").header("Authorization", "Bearer " + token))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.id").value(adminId.toString()))
        .andExpect(jsonPath("$.username").value("auth_admin"))
        .andExpect(jsonPath("$.role").value("department_admin"))
        .andExpect(jsonPath("$.capabilities.length()").value(8))
        .andExpect(jsonPath("$.passwordHash").doesNotExist());
  }

  @Test
  void tamperedTokenIs401() throws Exception {
    var token = login("auth_admin");

    mockMvc
        .perform(get("/api/auth/me").header("Authorization", "Bearer " + token + "x"))
        .andExpect(status().isUnauthorized());
  }

  @Test
  void deactivatedUserLosesAccessImmediately() throws Exception {
    var victimId =
        TestFixtures.createUser(
            userRepository, passwordEncoder, "auth_leaver", Role.AUDITOR, null);
    var token = login("auth_leaver");
    mockMvc
        .perform(get("/api/auth/me").header("Authorization", "Bearer " + token))
        .andExpect(status().isOk());

    mockMvc
        .perform(
            patch("/api/users/" + victimId)
                .header(USER_ID_HEADER, adminId.toString())
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"active": false}
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.active").value(false));

    mockMvc
        .perform(get("/api/auth/me").header("Authorization", "Bearer " + token))
        .andExpect(status().isUnauthorized());
    mockMvc
        .perform(
            post("/api/auth/login")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"username": "auth_leaver", "password": "%s"}
                    """
                        .formatted(PASSWORD)))
        .andExpect(status().isUnauthorized());
  }

  @Test
  void healthIsPublic() throws Exception {
    mockMvc.perform(get("/actuator/health")).andExpect(status().isOk());
  }
}
