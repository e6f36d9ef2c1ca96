package za.gov.ooh.oohbooking.document;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/**
 * Metadata for an uploaded file (artwork, proof of flighting, compliance record). The file itself
 * lives in external storage.
 */
@Entity
@Table(name = "documents")
public class Document {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "campaign_id")
  private UUID campaignId;

  @Column(name = "booking_id")
  private UUID bookingId;

  @Enumerated(EnumType.STRING)
  @Column(name = "document_type", nullable = false, length = 30)
  private DocumentType type;

  @Column(name = "file_name", nullable = false, length = 500)
  private String fileName;

  @Column(name = "file_size", nullable = false)
  private long fileSize;

  @Column(name = "mime_type", length = 100)
  private String mimeType;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private DocumentStatus status;

  @Column(name = "gps_latitude", length = 30)
  private String gpsLatitude;

  @Column(name = "gps_longitude", length = 30)
  private String gpsLongitude;

  @Column(name = "captured_at")
  private Instant capturedAt;

  @Column(name = "uploaded_by", nullable = false)
  private UUID uploadedBy;

  @Column(name = "uploaded_at", nullable = false, updatable = false)
  private Instant uploadedAt;

  protected Document() {}

  public Document(
      DocumentType type, String fileName, long fileSize, String mimeType, UUID uploadedBy) {
    this.type = type;
    this.fileName = fileName;
    this.fileSize = fileSize;
    this.mimeType = mimeType;
    this.status = DocumentStatus.UPLOADED;
    this.uploadedBy = uploadedBy;
    this.uploadedAt = Instant.now();
  }

  public void attachTo(UUID campaignId, UUID bookingId) {
    this.campaignId = campaignId;
    this.bookingId = bookingId;
  }

  public void correctMetadata(
      DocumentType type, String fileName, long fileSize, String mimeType) {
    this.type = type;
    this.fileName = fileName;
    this.fileSize = fileSize;
    this.mimeType = mimeType;
  }

  public void geotag(String gpsLatitude, String gpsLongitude, Instant capturedAt) {
    this.gpsLatitude = gpsLatitude;
    this.gpsLongitude = gpsLongitude;
    this.capturedAt = capturedAt;
  }

  public void review(DocumentStatus status) {
    this.status = status;
  }

  public UUID getId() {
    return id;
  }

  public UUID getCampaignId() {
    return campaignId;
  }

  public UUID getBookingId() {
    return bookingId;
  }

  public DocumentType getType() {
    return type;
  }

  public String getFileName() {
    return fileName;
  }

  public long getFileSize() {
    return fileSize;
  }

  public String getMimeType() {
    return mimeType;
  }

  public DocumentStatus getStatus() {
    return status;
  }

  public String getGpsLatitude() {
    return gpsLatitude;
  }

  public String getGpsLongitude() {
    return gpsLongitude;
  }

  public Instant getCapturedAt() {
    return capturedAt;
  }

  public UUID getUploadedBy() {
    return uploadedBy;
  }

  public Instant getUploadedAt() {
    return uploadedAt;
  }
}
