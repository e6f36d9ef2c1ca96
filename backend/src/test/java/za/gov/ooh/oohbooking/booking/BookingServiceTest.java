package za.gov.ooh.oohbooking.booking;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import za.gov.ooh.oohbooking.booking.dto.CreateBookingRequest;
import za.gov.ooh.oohbooking.booking.dto.UpdateBookingRequest;
import za.gov.ooh.oohbooking.campaign.CampaignService;
import za.gov.ooh.oohbooking.exception.InvalidRequestException;
import za.gov.ooh.oohbooking.exception.ResourceNotFoundException;
import za.gov.ooh.oohbooking.inventory.InventoryService;
import za.gov.ooh.oohbooking.supplier.SupplierService;

@ExtendWith(MockitoExtension.class)
class BookingServiceTest {

  @Mock private BookingRepository bookingRepository;
  @Mock private CampaignService campaignService;
  @Mock private SupplierService supplierService;
  @Mock private InventoryService inventoryService;
  @InjectMocks private BookingService service;

  private static final UUID CAMPAIGN_ID = UUID.randomUUID();
  private static final UUID SUPPLIER_ID = UUID.randomUUID();
  private static final UUID ITEM_ID = UUID.randomUUID();

  private static CreateBookingRequest createRequest(UUID inventoryItemId) {
    return new CreateBookingRequest(
        CAMPAIGN_ID,
        SUPPLIER_ID,
        inventoryItemId,
        "  N1 North digital  ",
        "Midrand",
        "digital_billboard",
        new BigDecimal("1500.50"),
        null,
        null,
        null);
  }

  @Test
  void createBooking_defaultsToPendingAndTrimsDescription() {
    when(bookingRepository.save(any(Booking.class))).thenAnswer(inv -> inv.getArgument(0));

    var booking = service.createBooking(createRequest(null));

    assertThat(booking.getStatus()).isEqualTo(BookingStatus.PENDING);
    assertThat(booking.getSiteDescription()).isEqualTo("N1 North digital");
    assertThat(booking.getCost()).isEqualByComparingTo("1500.50");
    verify(campaignService).requireExists("campaignId", CAMPAIGN_ID);
    verify(supplierService).requireExists("supplierId", SUPPLIER_ID);
    verifyNoInteractions(inventoryService);
  }

  @Test
  void createBooking_checksInventoryItemAgainstSupplier() {
    when(bookingRepository.save(any(Booking.class))).thenAnswer(inv -> inv.getArgument(0));

    var booking = service.createBooking(createRequest(ITEM_ID));

    assertThat(booking.getInventoryItemId()).isEqualTo(ITEM_ID);
    verify(inventoryService).requireBookable("inventoryItemId", ITEM_ID, SUPPLIER_ID);
  }

  @Test
  void createBooking_rejectsUnknownCampaign() {
    doThrow(new InvalidRequestException("campaignId", "campaign does not exist"))
        .when(campaignService)
        .requireExists("campaignId", CAMPAIGN_ID);

    assertThatThrownBy(() -> service.createBooking(createRequest(null)))
        .isInstanceOf(InvalidRequestException.class);
    verify(bookingRepository, never()).save(any());
  }

  @Test
  void updateBooking_leavesAbsentFieldsUntouched() {
    var existing = new Booking(CAMPAIGN_ID, SUPPLIER_ID, "Original site");
    existing.schedule(new BigDecimal("100.00"), null, null);
    var id = UUID.randomUUID();
    when(bookingRepository.findById(id)).thenReturn(Optional.of(existing));
    when(bookingRepository.save(any(Booking.class))).thenAnswer(inv -> inv.getArgument(0));

    var updated =
        service.updateBooking(
            id,
            new UpdateBookingRequest(
                null, null, null, null, null, null, null, BookingStatus.APPROVED, null, null));

    assertThat(updated.getStatus()).isEqualTo(BookingStatus.APPROVED);
    assertThat(updated.getSiteDescription()).isEqualTo("Original site");
    assertThat(updated.getCost()).isEqualByComparingTo("100.00");
    assertThat(updated.getCampaignId()).isEqualTo(CAMPAIGN_ID);
    verifyNoInteractions(campaignService, supplierService, inventoryService);
  }

  @Test
  void updateBooking_revalidatesLinkedItemWhenSupplierChanges() {
    var existing = new Booking(CAMPAIGN_ID, SUPPLIER_ID, "Site");
    existing.assign(CAMPAIGN_ID, SUPPLIER_ID, ITEM_ID);
    var id = UUID.randomUUID();
    var newSupplier = UUID.randomUUID();
    when(bookingRepository.findById(id)).thenReturn(Optional.of(existing));
    doThrow(new InvalidRequestException("inventoryItemId", "belongs to a different supplier"))
        .when(inventoryService)
        .requireBookable("inventoryItemId", ITEM_ID, newSupplier);

    assertThatThrownBy(
            () ->
                service.updateBooking(
                    id,
                    new UpdateBookingRequest(
                        null, newSupplier, null, null, null, null, null, null, null, null)))
        .isInstanceOf(InvalidRequestException.class);
    verify(bookingRepository, never()).save(any());
  }

  @Test
  void getBooking_throwsWhenMissing() {
    var id = UUID.randomUUID();
    when(bookingRepository.findById(id)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.getBooking(id))
        .isInstanceOf(ResourceNotFoundException.class);
  }
}
