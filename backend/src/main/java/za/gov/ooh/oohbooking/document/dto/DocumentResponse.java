package za.gov.ooh.oohbooking.document.dto;

import java.time.Instant;
import java.util.UUID;
import za.gov.ooh.oohbooking.document.Document;
import za.gov.ooh.oohbooking.document.DocumentStatus;
import za.gov.ooh.oohbooking.document.DocumentType;

public record DocumentResponse(
    UUID id,
    UUID campaignId,
    UUID bookingId,
    DocumentType type,
    String fileName,
    long fileSize,
    String mimeType,
    DocumentStatus status,
    String gpsLatitude,
    String gpsLongitude,
    Instant capturedAt,
    UUID uploadedBy,
    Instant uploadedAt) {

  public static DocumentResponse from(Document document) {
    return new DocumentResponse(
        document.getId(),
        document.getCampaignId(),
        document.getBookingId(),
        document.getType(),
        document.getFileName(),
        document.getFileSize(),
        document.getMimeType(),
        document.getStatus(),
        document.getGpsLatitude(),
        document.getGpsLongitude(),
        document.getCapturedAt(),
        document.getUploadedBy(),
        document.getUploadedAt());
  }
}
