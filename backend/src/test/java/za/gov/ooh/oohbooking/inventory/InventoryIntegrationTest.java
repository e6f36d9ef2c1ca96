package za.gov.ooh.oohbooking.inventory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.everyItem;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;
import static za.gov.ooh.oohbooking.TestFixtures.USER_ID_HEADER;

import com.jayway.jsonpath.JsonPath;
import java.math.BigDecimal;
import java.time.Instant;
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
import za.gov.ooh.oohbooking.user.AppUserRepository;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class InventoryIntegrationTest {

  @Autowired private MockMvc mockMvc;
  @Autowired private AppUserRepository userRepository;
  @Autowired private SupplierRepository supplierRepository;
  @Autowired private InventoryItemRepository inventoryItemRepository;
  @Autowired private PasswordEncoder passwordEncoder;

  private UUID supplierA;
  private UUID supplierB;
  private String adminId;
  private String supplierAUserId;
  private String unaffiliatedId;
  private UUID itemOfB;

  @BeforeAll
  void createFixtures() {
    supplierA = TestFixtures.createSupplier(supplierRepository, "inventory-a");
    supplierB = TestFixtures.createSupplier(supplierRepository, "inventory-b");
    adminId =
        TestFixtures.createUser(
                userRepository, passwordEncoder, "inv_admin", Role.DEPARTMENT_ADMIN, null)
            .toString();
    supplierAUserId =
        TestFixtures.createUser(
                userRepository, passwordEncoder, "inv_supplier_a", Role.SUPPLIER_USER, supplierA)
            .toString();
    unaffiliatedId =
        TestFixtures.createUser(
                userRepository, passwordEncoder, "inv_unaffiliated", Role.SUPPLIER_ADMIN, null)
            .toString();
    inventoryItemRepository.save(
        new InventoryItem(
            supplierA, "A Screen", "digital_billboard", "N1", "Gauteng", new BigDecimal("1.00")));
    itemOfB =
        inventoryItemRepository
            .save(
                new InventoryItem(
                    supplierB, "B Screen", "street_pole", "N2", "Western Cape", BigDecimal.TEN))
            .getId();
  }

  @Test
  void supplierSeesOnlyOwnItems() throws Exception {
    mockMvc
        .perform(get("/api/inventory").header(USER_ID_HEADER, supplierAUserId))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[*].screenName", hasItem("A Screen")))
        .andExpect(jsonPath("$[*].supplierId", everyItem(is(supplierA.toString()))));
  }

  @Test
  void supplierFilteringByAnotherSupplierGetsNothing() throws Exception {
    mockMvc
        .perform(
            get("/api/inventory")
                .param("supplierId", supplierB.toString())
                .header(USER_ID_HEADER, supplierAUserId))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$", hasSize(0)));
  }

  @Test
  void governmentCanFilterBySupplier() throws Exception {
    mockMvc
        .perform(
            get("/api/inventory")
                .param("supplierId", supplierB.toString())
                .header(USER_ID_HEADER, adminId))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[*].id", hasItem(itemOfB.toString())))
        .andExpect(jsonPath("$[*].supplierId", everyItem(is(supplierB.toString()))));
  }

  @Test
  void otherSuppliersItemIsNotFound() throws Exception {
    mockMvc
        .perform(get("/api/inventory/" + itemOfB).header(USER_ID_HEADER, supplierAUserId))
        .andExpect(status().isNotFound());
    mockMvc
        .perform(
            patch("/api/inventory/" + itemOfB)
                .header(USER_ID_HEADER, supplierAUserId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"status": "maintenance"}
                    """))
        .andExpect(status().isNotFound());
    mockMvc
        .perform(delete("/api/inventory/" + itemOfB).header(USER_ID_HEADER, supplierAUserId))
        .andExpect(status().isNotFound());
  }

  @Test
  void supplierCreateIsStampedWithOwnSupplier() throws Exception {
    var result =
        mockMvc
            .perform(
                post("/api/inventory")
                    .header(USER_ID_HEADER, supplierAUserId)
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(
                        """
                        {"supplierId": "%s", "screenName": "Sneaky Screen",
                         "screenType": "digital_billboard", "location": "M1", "region": "Gauteng",
                         "dailyRate": "3500.00", "digital": true, "illuminated": true}
                        """
                            .formatted(supplierB)))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.supplierId").value(supplierA.toString()))
            .andExpect(jsonPath("$.status").value("available"))
            .andExpect(jsonPath("$.dailyRate").value("3500.00"))
            .andExpect(jsonPath("$.digital").value(true))
            .andExpect(jsonPath("$.active").value(true))
            .andReturn();
    var id = TestFixtures.idOf(result);

    mockMvc
        .perform(
            patch("/api/inventory/" + id)
                .header(USER_ID_HEADER, supplierAUserId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"status": "maintenance", "dailyRate": "3750.00"}
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("maintenance"))
        .andExpect(jsonPath("$.dailyRate").value("3750.00"))
        .andExpect(jsonPath("$.screenName").value("Sneaky Screen"));
  }

  @Test
  void governmentCreateRequiresSupplier() throws Exception {
    mockMvc
        .perform(
            post("/api/inventory")
                .header(USER_ID_HEADER, adminId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"screenName": "Orphan", "screenType": "mall_screen", "location": "Mall",
                     "region": "Gauteng", "dailyRate": "100.00"}
                    """))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.errors[0].field").value("supplierId"));
  }

  @Test
  void unaffiliatedSupplierRoleSeesNothingAndCannotCreate() throws Exception {
    mockMvc
        .perform(get("/api/inventory").header(USER_ID_HEADER, unaffiliatedId))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$", hasSize(0)));
    mockMvc
        .perform(
            post("/api/inventory")
                .header(USER_ID_HEADER, unaffiliatedId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"screenName": "Nowhere", "screenType": "mall_screen", "location": "Mall",
                     "region": "Gauteng", "dailyRate": "100.00"}
                    """))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.errors[0].field").value("supplierId"));
  }

  @Test
  void missingDailyRateIsRejected() throws Exception {
    mockMvc
        .perform(
            post("/api/inventory")
                .header(USER_ID_HEADER, supplierAUserId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"screenName": "No Rate", "screenType": "mall_screen", "location": "Mall",
                     "region": "Gauteng"}
                    """))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.errors[0].field").value("dailyRate"));
  }

  @Test
  void updateRefreshesUpdatedAt() throws Exception {
    var created =
        mockMvc
            .perform(
                post("/api/inventory")
                    .header(USER_ID_HEADER, supplierAUserId)
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(
                        """
                        {"screenName": "Clocked Screen", "screenType": "street_pole",
                         "location": "R21", "region": "Gauteng", "dailyRate": "900.00"}
                        """))
            .andExpect(status().isCreated())
            .andReturn();
    var id = TestFixtures.idOf(created);
    Instant createdAt =
        Instant.parse(JsonPath.read(created.getResponse().getContentAsString(), "$.updatedAt"));

    Thread.sleep(20);

    var updated =
        mockMvc
            .perform(
                patch("/api/inventory/" + id)
                    .header(USER_ID_HEADER, supplierAUserId)
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(
                        """
                        {"illuminated": true}
                        """))
            .andExpect(status().isOk())
            .andReturn();
    Instant updatedAt =
        Instant.parse(JsonPath.read(updated.getResponse().getContentAsString(), "$.updatedAt"));

    assertThat(updatedAt).isAfter(createdAt);
  }
}
