package za.gov.ooh.oohbooking.booking;

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

import java.math.BigDecimal;
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
import za.gov.ooh.oohbooking.campaign.Campaign;
import za.gov.ooh.oohbooking.campaign.CampaignRepository;
import za.gov.ooh.oohbooking.inventory.InventoryItem;
import za.gov.ooh.oohbooking.inventory.InventoryItemRepository;
import za.gov.ooh.oohbooking.security.Role;
import za.gov.ooh.oohbooking.supplier.SupplierRepository;
import za.gov.ooh.oohbooking.user.AppUserRepository;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class BookingIntegrationTest {

  @Autowired private MockMvc mockMvc;
  @Autowired private AppUserRepository userRepository;
  @Autowired private SupplierRepository supplierRepository;
  @Autowired private CampaignRepository campaignRepository;
  @Autowired private InventoryItemRepository inventoryItemRepository;
  @Autowired private PasswordEncoder passwordEncoder;

  private String plannerId;
  private UUID campaignId;
  private UUID supplierId;
  private UUID otherSupplierId;
  private UUID ownItemId;
  private UUID foreignItemId;

  @BeforeAll
  void createFixtures() {
    plannerId =
        TestFixtures.createUser(
                userRepository, passwordEncoder, "book_planner", Role.CAMPAIGN_PLANNER, null)
            .toString();
    supplierId = TestFixtures.createSupplier(supplierRepository, "bookingsupplier");
    otherSupplierId = TestFixtures.createSupplier(supplierRepository, "bookingrival");
    campaignId =
        campaignRepository
            .save(new Campaign("Booking Campaign", null, UUID.fromString(plannerId)))
            .getId();
    ownItemId =
        inventoryItemRepository
            .save(
                new InventoryItem(
                    supplierId,
                    "M1 Gantry",
                    "digital_billboard",
                    "M1 South",
                    "Gauteng",
                    new BigDecimal("4500.00")))
            .getId();
    foreignItemId =
        inventoryItemRepository
            .save(
                new InventoryItem(
                    otherSupplierId,
                    "Rival Screen",
                    "static_billboard",
                    "R21",
                    "Gauteng",
                    new BigDecimal("900.00")))
            .getId();
  }

  private String createBooking(String extraFields) throws Exception {
    var result =
        mockMvc
            .perform(
                post("/api/bookings")
                    .header(USER_ID_HEADER, plannerId)
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(
                        """
                        {"campaignId": "%s", "supplierId": "%s",
                         "siteDescription": "M1 Gantry northbound"%s}
                        """
                            .formatted(campaignId, supplierId, extraFields)))
            .andExpect(status().isCreated())
            .andReturn();
    return TestFixtures.idOf(result);
  }

  @Test
  void createLinksInventoryItemAndDefaultsToPending() throws Exception {
    mockMvc
        .perform(
            post("/api/bookings")
                .header(USER_ID_HEADER, plannerId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"campaignId": "%s", "supplierId": "%s", "inventoryItemId": "%s",
                     "siteDescription": "M1 Gantry", "cost": "45000.00",
                     "mediaType": "digital_billboard"}
                    """
                        .formatted(campaignId, supplierId, ownItemId)))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.status").value("pending"))
        .andExpect(jsonPath("$.inventoryItemId").value(ownItemId.toString()))
        .andExpect(jsonPath("$.cost").value("45000.00"));
  }

  @Test
  void unknownCampaignIsRejected() throws Exception {
    mockMvc
        .perform(
            post("/api/bookings")
                .header(USER_ID_HEADER, plannerId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"campaignId": "%s", "supplierId": "%s", "siteDescription": "Nowhere"}
                    """
                        .formatted(UUID.randomUUID(), supplierId)))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.errors[0].field").value("campaignId"));
  }

  @Test
  void unknownSupplierIsRejected() throws Exception {
    mockMvc
        .perform(
            post("/api/bookings")
                .header(USER_ID_HEADER, plannerId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"campaignId": "%s", "supplierId": "%s", "siteDescription": "Nowhere"}
                    """
                        .formatted(campaignId, UUID.randomUUID())))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.errors[0].field").value("supplierId"));
  }

  @Test
  void inventoryItemOfAnotherSupplierIsRejected() throws Exception {
    mockMvc
        .perform(
            post("/api/bookings")
                .header(USER_ID_HEADER, plannerId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"campaignId": "%s", "supplierId": "%s", "inventoryItemId": "%s",
                     "siteDescription": "Wrong screen"}
                    """
                        .formatted(campaignId, supplierId, foreignItemId)))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.errors[0].field").value("inventoryItemId"));
  }

  @Test
  void missingRequiredFieldsAreAllReported() throws Exception {
    mockMvc
        .perform(
            post("/api/bookings")
                .header(USER_ID_HEADER, plannerId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.errors", hasSize(3)));
  }

  @Test
  void patchStatusThenFilterByIt() throws Exception {
    var id = createBooking("");

    mockMvc
        .perform(
            patch("/api/bookings/" + id)
                .header(USER_ID_HEADER, plannerId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"status": "rejected"}
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("rejected"))
        .andExpect(jsonPath("$.siteDescription").value("M1 Gantry northbound"));

    mockMvc
        .perform(
            get("/api/bookings")
                .param("campaignId", campaignId.toString())
                .param("status", "rejected")
                .header(USER_ID_HEADER, plannerId))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[*].id", hasItem(id)))
        .andExpect(jsonPath("$[*].status", everyItem(is("rejected"))));
  }

  @Test
  void deleteRemovesBooking() throws Exception {
    var id = createBooking(", \"cost\": \"10.00\"");

    mockMvc
        .perform(delete("/api/bookings/" + id).header(USER_ID_HEADER, plannerId))
        .andExpect(status().isNoContent());
    mockMvc
        .perform(get("/api/bookings/" + id).header(USER_ID_HEADER, plannerId))
        .andExpect(status().isNotFound());
  }
}
