package za.gov.ooh.oohbooking.seed;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import za.gov.ooh.oohbooking.booking.BookingStatus;
import za.gov.ooh.oohbooking.campaign.CampaignStatus;
import za.gov.ooh.oohbooking.document.DocumentStatus;
import za.gov.ooh.oohbooking.document.DocumentType;
import za.gov.ooh.oohbooking.inventory.InventoryStatus;
import za.gov.ooh.oohbooking.invoice.InvoiceStatus;
import za.gov.ooh.oohbooking.security.Role;

/**
 * Shape of {@code seed/demo-data.json}. Rows refer to each other through {@code key} values (users
 * through their username); ids are only known once rows are saved.
 */
record DemoDataSet(
    List<SupplierSeed> suppliers,
    List<UserSeed> users,
    List<CampaignSeed> campaigns,
    List<InventorySeed> inventory,
    List<BookingSeed> bookings,
    List<DocumentSeed> documents,
    List<InvoiceSeed> invoices) {

  record SupplierSeed(
      String key, String name, String contactPerson, String email, String phone, String address) {}

  record UserSeed(
      String username, String fullName, String email, Role role, String supplierKey) {}

  record CampaignSeed(
      String key,
      String name,
      String description,
      CampaignStatus status,
      BigDecimal budget,
      Instant startDate,
      Instant endDate,
      String region,
      Integer targetReach,
      String createdBy) {}

  record InventorySeed(
      String key,
      String supplierKey,
      String screenName,
      String screenType,
      String location,
      String region,
      String gpsLatitude,
      String gpsLongitude,
      String dimensions,
      String resolution,
      String facing,
      BigDecimal dailyRate,
      BigDecimal weeklyRate,
      BigDecimal monthlyRate,
      InventoryStatus status,
      boolean illuminated,
      boolean digital,
      Integer trafficCount) {}

  record BookingSeed(
      String key,
      String campaignKey,
      String supplierKey,
      String inventoryKey,
      String siteDescription,
      String location,
      String mediaType,
      BigDecimal cost,
      BookingStatus status,
      Instant startDate,
      Instant endDate) {}

  record DocumentSeed(
      String campaignKey,
      String bookingKey,
      DocumentType type,
      String fileName,
      long fileSize,
      String mimeType,
      DocumentStatus status,
      String gpsLatitude,
      String gpsLongitude,
      Instant capturedAt,
      String uploadedBy) {}

  record InvoiceSeed(
      String campaignKey,
      String supplierKey,
      String invoiceNumber,
      BigDecimal amount,
      InvoiceStatus status,
      Instant issuedAt,
      Instant dueDate) {}
}
