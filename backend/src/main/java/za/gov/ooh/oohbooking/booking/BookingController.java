package za.gov.ooh.oohbooking.booking;

import jakarta.validation.Valid;
import java.net.URI;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import za.gov.ooh.oohbooking.booking.dto.BookingResponse;
import za.gov.ooh.oohbooking.booking.dto.CreateBookingRequest;
import za.gov.ooh.oohbooking.booking.dto.UpdateBookingRequest;

@RestController
@RequestMapping("/api/bookings")
public class BookingController {

  private final BookingService bookingService;

  public BookingController(BookingService bookingService) {
    this.bookingService = bookingService;
  }

  @GetMapping
  public ResponseEntity<List<BookingResponse>> listBookings(
      @RequestParam(required = false) UUID campaignId,
      @RequestParam(required = false) UUID supplierId,
      @RequestParam(required = false) BookingStatus status) {
    var bookings =
        bookingService.listBookings(campaignId, supplierId, status).stream()
            .map(BookingResponse::from)
            .toList();
    return ResponseEntity.ok(bookings);
  }

  @GetMapping("/{id}")
  public ResponseEntity<BookingResponse> getBooking(@PathVariable UUID id) {
    return ResponseEntity.ok(BookingResponse.from(bookingService.getBooking(id)));
  }

  @PostMapping
  public ResponseEntity<BookingResponse> createBooking(
      @Valid @RequestBody CreateBookingRequest request) {
    var booking = bookingService.createBooking(request);
    return ResponseEntity.created(URI.create("/api/bookings/" + booking.getId()))
        .body(BookingResponse.from(booking));
  }

  @PatchMapping("/{id}")
  public ResponseEntity<BookingResponse> updateBooking(
      @PathVariable UUID id, @Valid @RequestBody UpdateBookingRequest request) {
    return ResponseEntity.ok(BookingResponse.from(bookingService.updateBooking(id, request)));
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<Void> deleteBooking(@PathVariable UUID id) {
    bookingService.deleteBooking(id);
    return ResponseEntity.noContent().build();
  }
}
