package za.gov.ooh.oohbooking.seed;

import java.io.IOException;
import java.io.InputStream;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ResourceLoader;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import tools.jackson.databind.ObjectMapper;
import za.gov.ooh.oohbooking.booking.Booking;
import za.gov.ooh.oohbooking.booking.BookingRepository;
import za.gov.ooh.oohbooking.campaign.Campaign;
import za.gov.ooh.oohbooking.campaign.CampaignRepository;
import za.gov.ooh.oohbooking.document.Document;
import za.gov.ooh.oohbooking.document.DocumentRepository;
import za.gov.ooh.oohbooking.inventory.InventoryItem;
import za.gov.ooh.oohbooking.inventory.InventoryItemRepository;
import za.gov.ooh.oohbooking.invoice.Invoice;
import za.gov.ooh.oohbooking.invoice.InvoiceRepository;
import za.gov.ooh.oohbooking.supplier.Supplier;
import za.gov.ooh.oohbooking.supplier.SupplierRepository;
import za.gov.ooh.oohbooking.user.AppUser;
import za.gov.ooh.oohbooking.user.AppUserRepository;

/**
 * Loads the demo data set from {@code seed/demo-data.json}. Idempotent: when the {@code admin} user
 * already exists nothing is written.
 */
@Service
public class SeedService {

  private static final Logger log = LoggerFactory.getLogger(SeedService.class);
  static final String MARKER_USERNAME = "admin";

  private final SeedProperties properties;
  private final ResourceLoader resourceLoader;
  private final ObjectMapper objectMapper;
  private final PasswordEncoder passwordEncoder;
  private final SupplierRepository supplierRepository;
  private final AppUserRepository userRepository;
  private final CampaignRepository campaignRepository;
  private final InventoryItemRepository inventoryItemRepository;
  private final BookingRepository bookingRepository;
  private final DocumentRepository documentRepository;
  private final InvoiceRepository invoiceRepository;

  public SeedService(
      SeedProperties properties,
      ResourceLoader resourceLoader,
      ObjectMapper objectMapper,
      PasswordEncoder passwordEncoder,
      SupplierRepository supplierRepository,
      AppUserRepository userRepository,
      CampaignRepository campaignRepository,
      InventoryItemRepository inventoryItemRepository,
      BookingRepository bookingRepository,
      DocumentRepository documentRepository,
      InvoiceRepository invoiceRepository) {
    this.properties = properties;
    this.resourceLoader = resourceLoader;
    this.objectMapper = objectMapper;
    this.passwordEncoder = passwordEncoder;
    this.supplierRepository = supplierRepository;
    this.userRepository = userRepository;
    this.campaignRepository = campaignRepository;
    this.inventoryItemRepository = inventoryItemRepository;
    this.bookingRepository = bookingRepository;
    this.documentRepository = documentRepository;
    this.invoiceRepository = invoiceRepository;
  }

  /** Row counts written by one seeding run. All zero when the data was already present. */
  public record SeedResult(
      boolean seeded,
      int suppliers,
      int users,
      int campaigns,
      int inventoryItems,
      int bookings,
      int documents,
      int invoices) {

    static SeedResult alreadySeeded() {
      return new SeedResult(false, 0, 0, 0, 0, 0, 0, 0);
    }
  }

  @Transactional
  public SeedResult seed() {
    if (userRepository.existsByUsername(MARKER_USERNAME)) {
      log.info("Demo data already present, skipping seed");
      return SeedResult.alreadySeeded();
    }

    DemoDataSet data = loadDataSet();
    String passwordHash = passwordEncoder.encode(properties.demoPassword());

    Map<String, UUID> supplierIds = new HashMap<>();
    for (var s : data.suppliers()) {
      var supplier =
          supplierRepository.save(
              new Supplier(s.name(), s.contactPerson(), s.email(), s.phone(), s.address()));
      supplierIds.put(s.key(), supplier.getId());
    }

    Map<String, UUID> userIds = new HashMap<>();
    for (var u : data.users()) {
      var user =
          userRepository.save(
              new AppUser(
                  u.username(),
                  passwordHash,
                  u.fullName(),
                  u.email(),
                  u.role(),
                  lookup(supplierIds, u.supplierKey())));
      userIds.put(u.username(), user.getId());
    }

    Map<String, UUID> campaignIds = new HashMap<>();
    for (var c : data.campaigns()) {
      var campaign = new Campaign(c.name(), c.description(), require(userIds, c.createdBy()));
      campaign.updateDetails(c.name(), c.description(), c.region(), c.targetReach());
      campaign.plan(c.budget(), c.startDate(), c.endDate());
      campaign.changeStatus(c.status());
      campaignIds.put(c.key(), campaignRepository.save(campaign).getId());
    }

    Map<String, UUID> inventoryIds = new HashMap<>();
    for (var i : data.inventory()) {
      var item =
          new InventoryItem(
              require(supplierIds, i.supplierKey()),
              i.screenName(),
              i.screenType(),
              i.location(),
              i.region(),
              i.dailyRate());
      item.locate(i.gpsLatitude(), i.gpsLongitude(), i.facing());
      item.specify(
          i.dimensions(), i.resolution(), i.illuminated(), i.digital(), i.trafficCount());
      item.price(i.dailyRate(), i.weeklyRate(), i.monthlyRate());
      item.changeAvailability(i.status(), null, null);
      inventoryIds.put(i.key(), inventoryItemRepository.save(item).getId());
    }

    Map<String, UUID> bookingIds = new HashMap<>();
    for (var b : data.bookings()) {
      var booking =
          new Booking(
              require(campaignIds, b.campaignKey()),
              require(supplierIds, b.supplierKey()),
              b.siteDescription());
      booking.assign(
          booking.getCampaignId(), booking.getSupplierId(), lookup(inventoryIds, b.inventoryKey()));
      booking.describeSite(b.siteDescription(), b.location(), b.mediaType());
      booking.schedule(b.cost(), b.startDate(), b.endDate());
      booking.changeStatus(b.status());
      bookingIds.put(b.key(), bookingRepository.save(booking).getId());
    }

    for (var d : data.documents()) {
      var document =
          new Document(
              d.type(), d.fileName(), d.fileSize(), d.mimeType(), require(userIds, d.uploadedBy()));
      document.attachTo(lookup(campaignIds, d.campaignKey()), lookup(bookingIds, d.bookingKey()));
      document.geotag(d.gpsLatitude(), d.gpsLongitude(), d.capturedAt());
      document.review(d.status());
      documentRepository.save(document);
    }

    for (var inv : data.invoices()) {
      var invoice =
          new Invoice(
              require(campaignIds, inv.campaignKey()),
              lookup(supplierIds, inv.supplierKey()),
              inv.invoiceNumber(),
              inv.amount());
      invoice.schedule(inv.issuedAt(), inv.dueDate());
      invoice.changeStatus(inv.status());
      invoiceRepository.save(invoice);
    }

    var result =
        new SeedResult(
            true,
            data.suppliers().size(),
            data.users().size(),
            data.campaigns().size(),
            data.inventory().size(),
            data.bookings().size(),
            data.documents().size(),
            data.invoices().size());
    log.info("Seeded demo data: {}", result);
    return result;
  }

  private DemoDataSet loadDataSet() {
    var resource = resourceLoader.getResource(properties.dataLocation());
    try (InputStream in = resource.getInputStream()) {
      return objectMapper.readValue(in, DemoDataSet.class);
    } catch (IOException e) {
      throw new IllegalStateException(
          "Failed to read demo data from " + properties.dataLocation(), e);
    }
  }

  private static UUID lookup(Map<String, UUID> ids, String key) {
    return key != null ? require(ids, key) : null;
  }

  private static UUID require(Map<String, UUID> ids, String key) {
    UUID id = ids.get(key);
    if (id == null) {
      throw new IllegalStateException("Demo data refers to unknown key '" + key + "'");
    }
    return id;
  }
}
