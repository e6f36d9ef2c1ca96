package za.gov.ooh.oohbooking.document.dto;

import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import java.time.Instant;
import java.util.UUID;
import za.gov.ooh.oohbooking.common.GeoPatterns;
import za.gov.ooh.oohbooking.document.DocumentStatus;
import za.gov.ooh.oohbooking.document.DocumentType;

/** Partial update: a review decision via {@code status}, or metadata corrections. */
public record UpdateDocumentRequest(
    UUID campaignId,
    UUID bookingId,
    DocumentType type,
    @Pattern(regexp = ".*\\S.*", message = "fileName must not be blank") @Size(max = 500)
        String fileName,
    @PositiveOrZero Long fileSize,
    @Size(max = 100) String mimeType,
    DocumentStatus status,
    @Pattern(regexp = GeoPatterns.LATITUDE, message = GeoPatterns.LATITUDE_MESSAGE)
        String gpsLatitude,
    @Pattern(regexp = GeoPatterns.LONGITUDE, message = GeoPatterns.LONGITUDE_MESSAGE)
        String gpsLongitude,
    Instant capturedAt) {}
