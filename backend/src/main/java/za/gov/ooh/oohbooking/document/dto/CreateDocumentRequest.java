package za.gov.ooh.oohbooking.document.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import java.time.Instant;
import java.util.UUID;
import za.gov.ooh.oohbooking.common.GeoPatterns;
import za.gov.ooh.oohbooking.document.DocumentStatus;
import za.gov.ooh.oohbooking.document.DocumentType;

/** {@code uploadedBy} defaults to the caller. */
public record CreateDocumentRequest(
    UUID campaignId,
    UUID bookingId,
    @NotNull(message = "type is required") DocumentType type,
    @NotBlank(message = "fileName is required") @Size(max = 500) String fileName,
    @NotNull(message = "fileSize is required") @PositiveOrZero Long fileSize,
    @Size(max = 100) String mimeType,
    DocumentStatus status,
    @Pattern(regexp = GeoPatterns.LATITUDE, message = GeoPatterns.LATITUDE_MESSAGE)
        String gpsLatitude,
    @Pattern(regexp = GeoPatterns.LONGITUDE, message = GeoPatterns.LONGITUDE_MESSAGE)
        String gpsLongitude,
    Instant capturedAt,
    UUID uploadedBy) {}
