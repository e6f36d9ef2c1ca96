package za.gov.ooh.oohbooking.dashboard;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;
import static za.gov.ooh.oohbooking.TestFixtures.USER_ID_HEADER;

import com.jayway.jsonpath.JsonPath;
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
import za.gov.ooh.oohbooking.campaign.CampaignStatus;
import za.gov.ooh.oohbooking.security.Role;
import za.gov.ooh.oohbooking.supplier.SupplierRepository;
import za.gov.ooh.oohbooking.user.AppUserRepository;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class DashboardIntegrationTest {

  @Autowired private MockMvc mockMvc;
  @Autowired private AppUserRepository userRepository;
  @Autowired private SupplierRepository supplierRepository;
  @Autowired private CampaignRepository campaignRepository;
  @Autowired private PasswordEncoder passwordEncoder;

  private String auditorId;
  private UUID campaignId;
  private UUID supplierId;

  @BeforeAll
  void createFixtures() {
    var id =
        TestFixtures.createUser(userRepository, passwordEncoder, "dash_auditor", Role.AUDITOR, null);
    auditorId = id.toString();
    supplierId = TestFixtures.createSupplier(supplierRepository, "dashboardsupplier");
    campaignId = campaignRepository.save(new Campaign("Dashboard Campaign", null, id)).getId();
  }

  private String stats() throws Exception {
    return mockMvc
        .perform(get("/api/dashboard/stats").header(USER_ID_HEADER, auditorId))
        .andExpect(status().isOk())
        .andReturn()
        .getResponse()
        .getContentAsString();
  }

  private static long count(String json, String field) {
    return ((Number) JsonPath.read(json, "$." + field)).longValue();
  }

  private void book(String costJson) throws Exception {
    mockMvc
        .perform(
            post("/api/bookings")
                .header(USER_ID_HEADER, auditorId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"campaignId": "%s", "supplierId": "%s", "siteDescription": "Dashboard site"%s}
                    """
                        .formatted(campaignId, supplierId, costJson)))
        .andExpect(status().isCreated());
  }

  @Test
  void totalSpendGrowsByExactBookingCost() throws Exception {
    var before = stats();

    book(", \"cost\": \"85000.00\"");

    var after = stats();
    String spendBefore = JsonPath.read(before, "$.totalSpend");
    String spendAfter = JsonPath.read(after, "$.totalSpend");
    assertThat(new BigDecimal(spendAfter).subtract(new BigDecimal(spendBefore)))
        .isEqualByComparingTo("85000.00");
    assertThat(count(after, "totalBookings") - count(before, "totalBookings")).isEqualTo(1);
    assertThat(count(after, "pendingBookings") - count(before, "pendingBookings")).isEqualTo(1);
  }

  @Test
  void fractionalCostsSumWithoutRounding() throws Exception {
    var before = stats();

    book(", \"cost\": \"0.10\"");
    book(", \"cost\": \"0.20\"");

    String spendBefore = JsonPath.read(before, "$.totalSpend");
    String spendAfter = JsonPath.read(stats(), "$.totalSpend");
    assertThat(new BigDecimal(spendAfter).subtract(new BigDecimal(spendBefore)))
        .isEqualByComparingTo("0.30");
  }

  @Test
  void bookingWithoutCostAddsNothingToSpend() throws Exception {
    var before = stats();

    book("");

    var after = stats();
    String spendBefore = JsonPath.read(before, "$.totalSpend");
    String spendAfter = JsonPath.read(after, "$.totalSpend");
    assertThat(new BigDecimal(spendAfter)).isEqualByComparingTo(new BigDecimal(spendBefore));
    assertThat(count(after, "totalBookings") - count(before, "totalBookings")).isEqualTo(1);
  }

  @Test
  void activeCampaignsCountsInProgressOnly() throws Exception {
    var before = stats();

    var active = new Campaign("Running Now", null, UUID.fromString(auditorId));
    active.changeStatus(CampaignStatus.IN_PROGRESS);
    campaignRepository.save(active);
    campaignRepository.save(new Campaign("Still Draft", null, UUID.fromString(auditorId)));

    var after = stats();
    assertThat(count(after, "totalCampaigns") - count(before, "totalCampaigns")).isEqualTo(2);
    assertThat(count(after, "activeCampaigns") - count(before, "activeCampaigns")).isEqualTo(1);
  }
}
