package za.gov.ooh.oohbooking.client;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.util.UriComponentsBuilder;
import za.gov.ooh.oohbooking.booking.BookingStatus;
import za.gov.ooh.oohbooking.booking.dto.BookingResponse;
import za.gov.ooh.oohbooking.booking.dto.CreateBookingRequest;
import za.gov.ooh.oohbooking.booking.dto.UpdateBookingRequest;
import za.gov.ooh.oohbooking.campaign.CampaignStatus;
import za.gov.ooh.oohbooking.campaign.dto.CampaignResponse;
import za.gov.ooh.oohbooking.campaign.dto.CreateCampaignRequest;
import za.gov.ooh.oohbooking.campaign.dto.UpdateCampaignRequest;
import za.gov.ooh.oohbooking.dashboard.dto.DashboardStats;
import za.gov.ooh.oohbooking.document.DocumentStatus;
import za.gov.ooh.oohbooking.document.DocumentType;
import za.gov.ooh.oohbooking.document.dto.CreateDocumentRequest;
import za.gov.ooh.oohbooking.document.dto.DocumentResponse;
import za.gov.ooh.oohbooking.document.dto.UpdateDocumentRequest;
import za.gov.ooh.oohbooking.inventory.InventoryStatus;
import za.gov.ooh.oohbooking.inventory.dto.CreateInventoryItemRequest;
import za.gov.ooh.oohbooking.inventory.dto.InventoryItemResponse;
import za.gov.ooh.oohbooking.inventory.dto.UpdateInventoryItemRequest;
import za.gov.ooh.oohbooking.invoice.InvoiceStatus;
import za.gov.ooh.oohbooking.invoice.dto.CreateInvoiceRequest;
import za.gov.ooh.oohbooking.invoice.dto.InvoiceResponse;
import za.gov.ooh.oohbooking.invoice.dto.UpdateInvoiceRequest;
import za.gov.ooh.oohbooking.security.Role;
import za.gov.ooh.oohbooking.supplier.dto.CreateSupplierRequest;
import za.gov.ooh.oohbooking.supplier.dto.SupplierResponse;
import za.gov.ooh.oohbooking.supplier.dto.UpdateSupplierRequest;
import za.gov.ooh.oohbooking.user.AuthController.LoginRequest;
import za.gov.ooh.oohbooking.user.AuthController.LoginResponse;
import za.gov.ooh.oohbooking.user.AuthController.MeResponse;
import za.gov.ooh.oohbooking.user.dto.CreateUserRequest;
import za.gov.ooh.oohbooking.user.dto.UpdateUserRequest;
import za.gov.ooh.oohbooking.user.dto.UserResponse;

/**
 * Typed client for the booking API, for use by presentation layers.
 *
 * <p>Every request carries the session's bearer token. GET responses are cached; reads that depend
 * on the caller (inventory and the current user) are keyed by user id. A mutation drops the cached
 * reads it can affect, {@link #logout()} drops all of them, and a 401 on any authenticated request
 * ends the session and raises {@link SessionExpiredException}.
 */
public class OohApiClient {

  private static final Logger log = LoggerFactory.getLogger(OohApiClient.class);

  static final String ME = "me";
  static final String DASHBOARD = "dashboard";
  static final String CAMPAIGNS = "campaigns";
  static final String BOOKINGS = "bookings";
  static final String INVENTORY = "inventory";
  static final String DOCUMENTS = "documents";
  static final String INVOICES = "invoices";
  static final String SUPPLIERS = "suppliers";
  static final String USERS = "users";

  private final RestClient restClient;
  private final OohSession session;
  private final ReadCache cache;

  /**
   * @param builder a builder already pointing at the API's base URL
   * @param cacheTtl how long a cached read may be served
   */
  public OohApiClient(RestClient.Builder builder, OohSession session, Duration cacheTtl) {
    this.restClient = builder.build();
    this.session = session;
    this.cache = new ReadCache(cacheTtl);
  }

  public static OohApiClient create(String baseUrl, OohSession session) {
    return new OohApiClient(RestClient.builder().baseUrl(baseUrl), session, Duration.ofMinutes(5));
  }

  // --- Session ---

  /** Signs in and starts a new session. Reads cached under any earlier session are dropped. */
  public LoginResponse login(String username, String password) {
    var response =
        restClient
            .post()
            .uri("/api/auth/login")
            .contentType(MediaType.APPLICATION_JSON)
            .body(new LoginRequest(username, password))
            .retrieve()
            .body(LoginResponse.class);
    cache.invalidateAll();
    session.start(response);
    log.info("Signed in as {}", response.username());
    return response;
  }

  /** Ends the session locally and discards every cached read. */
  public void logout() {
    session.clear();
    cache.invalidateAll();
  }

  public MeResponse me() {
    return read(ME, true, "/api/auth/me", new ParameterizedTypeReference<>() {});
  }

  public DashboardStats dashboardStats() {
    return read(DASHBOARD, false, "/api/dashboard/stats", new ParameterizedTypeReference<>() {});
  }

  // --- Campaigns ---

  public List<CampaignResponse> listCampaigns(CampaignStatus status, String region) {
    String uri =
        UriComponentsBuilder.fromPath("/api/campaigns")
            .queryParamIfPresent("status", Optional.ofNullable(status).map(CampaignStatus::getValue))
            .queryParamIfPresent("region", Optional.ofNullable(region))
            .toUriString();
    return read(CAMPAIGNS, false, uri, new ParameterizedTypeReference<>() {});
  }

  public CampaignResponse getCampaign(UUID id) {
    return read(CAMPAIGNS, false, "/api/campaigns/" + id, new ParameterizedTypeReference<>() {});
  }

  public CampaignResponse createCampaign(CreateCampaignRequest request) {
    return post("/api/campaigns", request, CampaignResponse.class, Set.of(CAMPAIGNS, DASHBOARD));
  }

  public CampaignResponse updateCampaign(UUID id, UpdateCampaignRequest request) {
    return patch(
        "/api/campaigns/" + id, request, CampaignResponse.class, Set.of(CAMPAIGNS, DASHBOARD));
  }

  public void deleteCampaign(UUID id) {
    delete("/api/campaigns/" + id, Set.of(CAMPAIGNS, DASHBOARD));
  }

  // --- Bookings ---

  public List<BookingResponse> listBookings(
      UUID campaignId, UUID supplierId, BookingStatus status) {
    String uri =
        UriComponentsBuilder.fromPath("/api/bookings")
            .queryParamIfPresent("campaignId", Optional.ofNullable(campaignId))
            .queryParamIfPresent("supplierId", Optional.ofNullable(supplierId))
            .queryParamIfPresent("status", Optional.ofNullable(status).map(BookingStatus::getValue))
            .toUriString();
    return read(BOOKINGS, false, uri, new ParameterizedTypeReference<>() {});
  }

  public BookingResponse createBooking(CreateBookingRequest request) {
    return post("/api/bookings", request, BookingResponse.class, Set.of(BOOKINGS, DASHBOARD));
  }

  public BookingResponse updateBooking(UUID id, UpdateBookingRequest request) {
    return patch(
        "/api/bookings/" + id, request, BookingResponse.class, Set.of(BOOKINGS, DASHBOARD));
  }

  public void deleteBooking(UUID id) {
    delete("/api/bookings/" + id, Set.of(BOOKINGS, DASHBOARD));
  }

  // --- Inventory ---

  public List<InventoryItemResponse> listInventory(
      UUID supplierId, String region, InventoryStatus status, String screenType) {
    String uri =
        UriComponentsBuilder.fromPath("/api/inventory")
            .queryParamIfPresent("supplierId", Optional.ofNullable(supplierId))
            .queryParamIfPresent("region", Optional.ofNullable(region))
            .queryParamIfPresent(
                "status", Optional.ofNullable(status).map(InventoryStatus::getValue))
            .queryParamIfPresent("screenType", Optional.ofNullable(screenType))
            .toUriString();
    return read(INVENTORY, true, uri, new ParameterizedTypeReference<>() {});
  }

  public InventoryItemResponse getInventoryItem(UUID id) {
    return read(INVENTORY, true, "/api/inventory/" + id, new ParameterizedTypeReference<>() {});
  }

  public InventoryItemResponse createInventoryItem(CreateInventoryItemRequest request) {
    return post("/api/inventory", request, InventoryItemResponse.class, Set.of(INVENTORY));
  }

  public InventoryItemResponse updateInventoryItem(UUID id, UpdateInventoryItemRequest request) {
    return patch("/api/inventory/" + id, request, InventoryItemResponse.class, Set.of(INVENTORY));
  }

  public void deleteInventoryItem(UUID id) {
    delete("/api/inventory/" + id, Set.of(INVENTORY));
  }

  // --- Documents ---

  public List<DocumentResponse> listDocuments(
      UUID campaignId, UUID bookingId, DocumentType type, DocumentStatus status) {
    String uri =
        UriComponentsBuilder.fromPath("/api/documents")
            .queryParamIfPresent("campaignId", Optional.ofNullable(campaignId))
            .queryParamIfPresent("bookingId", Optional.ofNullable(bookingId))
            .queryParamIfPresent("type", Optional.ofNullable(type).map(DocumentType::getValue))
            .queryParamIfPresent(
                "status", Optional.ofNullable(status).map(DocumentStatus::getValue))
            .toUriString();
    return read(DOCUMENTS, false, uri, new ParameterizedTypeReference<>() {});
  }

  public DocumentResponse createDocument(CreateDocumentRequest request) {
    return post("/api/documents", request, DocumentResponse.class, Set.of(DOCUMENTS));
  }

  public DocumentResponse updateDocument(UUID id, UpdateDocumentRequest request) {
    return patch("/api/documents/" + id, request, DocumentResponse.class, Set.of(DOCUMENTS));
  }

  public void deleteDocument(UUID id) {
    delete("/api/documents/" + id, Set.of(DOCUMENTS));
  }

  // --- Invoices ---

  public List<InvoiceResponse> listInvoices(
      UUID campaignId, UUID supplierId, InvoiceStatus status) {
    String uri =
        UriComponentsBuilder.fromPath("/api/invoices")
            .queryParamIfPresent("campaignId", Optional.ofNullable(campaignId))
            .queryParamIfPresent("supplierId", Optional.ofNullable(supplierId))
            .queryParamIfPresent("status", Optional.ofNullable(status).map(InvoiceStatus::getValue))
            .toUriString();
    return read(INVOICES, false, uri, new ParameterizedTypeReference<>() {});
  }

  public InvoiceResponse createInvoice(CreateInvoiceRequest request) {
    return post("/api/invoices", request, InvoiceResponse.class, Set.of(INVOICES));
  }

  public InvoiceResponse updateInvoice(UUID id, UpdateInvoiceRequest request) {
    return patch("/api/invoices/" + id, request, InvoiceResponse.class, Set.of(INVOICES));
  }

  public void deleteInvoice(UUID id) {
    delete("/api/invoices/" + id, Set.of(INVOICES));
  }

  // --- Suppliers and users ---

  public List<SupplierResponse> listSuppliers(Boolean active) {
    String uri =
        UriComponentsBuilder.fromPath("/api/suppliers")
            .queryParamIfPresent("active", Optional.ofNullable(active))
            .toUriString();
    return read(SUPPLIERS, false, uri, new ParameterizedTypeReference<>() {});
  }

  public SupplierResponse createSupplier(CreateSupplierRequest request) {
    return post("/api/suppliers", request, SupplierResponse.class, Set.of(SUPPLIERS));
  }

  public SupplierResponse updateSupplier(UUID id, UpdateSupplierRequest request) {
    return patch("/api/suppliers/" + id, request, SupplierResponse.class, Set.of(SUPPLIERS));
  }

  public List<UserResponse> listUsers(Role role, UUID supplierId, Boolean active) {
    String uri =
        UriComponentsBuilder.fromPath("/api/users")
            .queryParamIfPresent("role", Optional.ofNullable(role).map(Role::getValue))
            .queryParamIfPresent("supplierId", Optional.ofNullable(supplierId))
            .queryParamIfPresent("active", Optional.ofNullable(active))
            .toUriString();
    return read(USERS, false, uri, new ParameterizedTypeReference<>() {});
  }

  public UserResponse createUser(CreateUserRequest request) {
    return post("/api/users", request, UserResponse.class, Set.of(USERS));
  }

  public UserResponse updateUser(UUID id, UpdateUserRequest request) {
    return patch("/api/users/" + id, request, UserResponse.class, Set.of(USERS, ME));
  }

  // --- Plumbing ---

  private <T> T read(
      String resource, boolean perUser, String uri, ParameterizedTypeReference<T> type) {
    UUID userId = perUser ? session.current().map(StoredSession::userId).orElse(null) : null;
    return cache.get(
        new ReadCache.Key(resource, uri, userId),
        () -> authenticated(restClient.get().uri(uri)).body(type));
  }

  private <T> T post(String uri, Object body, Class<T> type, Set<String> affected) {
    var result =
        authenticated(
                restClient.post().uri(uri).contentType(MediaType.APPLICATION_JSON).body(body))
            .body(type);
    cache.invalidate(affected);
    return result;
  }

  private <T> T patch(String uri, Object body, Class<T> type, Set<String> affected) {
    var result =
        authenticated(
                restClient.patch().uri(uri).contentType(MediaType.APPLICATION_JSON).body(body))
            .body(type);
    cache.invalidate(affected);
    return result;
  }

  private void delete(String uri, Set<String> affected) {
    authenticated(restClient.delete().uri(uri)).toBodilessEntity();
    cache.invalidate(affected);
  }

  private RestClient.ResponseSpec authenticated(RestClient.RequestHeadersSpec<?> request) {
    return request
        .headers(this::applyBearerToken)
        .retrieve()
        .onStatus(
            status -> status.value() == HttpStatus.UNAUTHORIZED.value(),
            (req, res) -> {
              log.info("Session rejected by server on {} {}", req.getMethod(), req.getURI());
              session.clear();
              cache.invalidateAll();
              throw new SessionExpiredException("Your session has expired, please sign in again");
            });
  }

  private void applyBearerToken(HttpHeaders headers) {
    session.current().ifPresent(s -> headers.setBearerAuth(s.token()));
  }
}
