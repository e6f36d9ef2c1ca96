package za.gov.ooh.oohbooking.booking;

import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import za.gov.ooh.oohbooking.booking.dto.CreateBookingRequest;
import za.gov.ooh.oohbooking.booking.dto.UpdateBookingRequest;
import za.gov.ooh.oohbooking.campaign.CampaignService;
import za.gov.ooh.oohbooking.exception.InvalidRequestException;
import za.gov.ooh.oohbooking.exception.ResourceNotFoundException;
import za.gov.ooh.oohbooking.inventory.InventoryService;
import za.gov.ooh.oohbooking.supplier.SupplierService;

@Service
public class BookingService {

  private static final Logger log = LoggerFactory.getLogger(BookingService.class);

  private final BookingRepository bookingRepository;
  private final CampaignService campaignService;
  private final SupplierService supplierService;
  private final InventoryService inventoryService;

  public BookingService(
      BookingRepository bookingRepository,
      CampaignService campaignService,
      SupplierService supplierService,
      InventoryService inventoryService) {
    this.bookingRepository = bookingRepository;
    this.campaignService = campaignService;
    this.supplierService = supplierService;
    this.inventoryService = inventoryService;
  }

  @Transactional(readOnly = true)
  public List<Booking> listBookings(UUID campaignId, UUID supplierId, BookingStatus status) {
    return bookingRepository.findByFilters(campaignId, supplierId, status);
  }

  @Transactional(readOnly = true)
  public Booking getBooking(UUID id) {
    return bookingRepository
        .findById(id)
        .orElseThrow(() -> new ResourceNotFoundException("Booking", id));
  }

  /**
   * Rejects a reference to a booking that does not exist.
   *
   * @param field the request field reported in the 400 response
   */
  @Transactional(readOnly = true)
  public void requireExists(String field, UUID bookingId) {
    if (!bookingRepository.existsById(bookingId)) {
      throw new InvalidRequestException(field, "booking " + bookingId + " does not exist");
    }
  }

  @Transactional
  public Booking createBooking(CreateBookingRequest request) {
    campaignService.requireExists("campaignId", request.campaignId());
    supplierService.requireExists("supplierId", request.supplierId());
    if (request.inventoryItemId() != null) {
      inventoryService.requireBookable(
          "inventoryItemId", request.inventoryItemId(), request.supplierId());
    }

    var booking =
        new Booking(request.campaignId(), request.supplierId(), request.siteDescription().trim());
    booking.assign(request.campaignId(), request.supplierId(), request.inventoryItemId());
    booking.describeSite(booking.getSiteDescription(), request.location(), request.mediaType());
    booking.schedule(request.cost(), request.startDate(), request.endDate());
    if (request.status() != null) {
      booking.changeStatus(request.status());
    }

    booking = bookingRepository.save(booking);
    log.info(
        "Created booking {} for campaign {} with supplier {}",
        booking.getId(),
        booking.getCampaignId(),
        booking.getSupplierId());
    return booking;
  }

  @Transactional
  public Booking updateBooking(UUID id, UpdateBookingRequest request) {
    var booking = getBooking(id);

    UUID campaignId =
        request.campaignId() != null ? request.campaignId() : booking.getCampaignId();
    UUID supplierId =
        request.supplierId() != null ? request.supplierId() : booking.getSupplierId();
    UUID inventoryItemId =
        request.inventoryItemId() != null
            ? request.inventoryItemId()
            : booking.getInventoryItemId();

    if (request.campaignId() != null) {
      campaignService.requireExists("campaignId", campaignId);
    }
    if (request.supplierId() != null) {
      supplierService.requireExists("supplierId", supplierId);
    }
    if (inventoryItemId != null
        && (request.inventoryItemId() != null || request.supplierId() != null)) {
      inventoryService.requireBookable("inventoryItemId", inventoryItemId, supplierId);
    }
    booking.assign(campaignId, supplierId, inventoryItemId);

    booking.describeSite(
        request.siteDescription() != null
            ? request.siteDescription().trim()
            : booking.getSiteDescription(),
        request.location() != null ? request.location() : booking.getLocation(),
        request.mediaType() != null ? request.mediaType() : booking.getMediaType());
    booking.schedule(
        request.cost() != null ? request.cost() : booking.getCost(),
        request.startDate() != null ? request.startDate() : booking.getStartDate(),
        request.endDate() != null ? request.endDate() : booking.getEndDate());

    if (request.status() != null && request.status() != booking.getStatus()) {
      log.info("Booking {} status {} -> {}", id, booking.getStatus(), request.status());
      booking.changeStatus(request.status());
    }
    return bookingRepository.save(booking);
  }

  @Transactional
  public void deleteBooking(UUID id) {
    var booking = getBooking(id);
    bookingRepository.delete(booking);
    log.info("Deleted booking {}", id);
  }
}
