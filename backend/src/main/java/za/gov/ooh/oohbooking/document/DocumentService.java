package za.gov.ooh.oohbooking.document;

import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import za.gov.ooh.oohbooking.booking.BookingService;
import za.gov.ooh.oohbooking.campaign.CampaignService;
import za.gov.ooh.oohbooking.document.dto.CreateDocumentRequest;
import za.gov.ooh.oohbooking.document.dto.UpdateDocumentRequest;
import za.gov.ooh.oohbooking.exception.ResourceNotFoundException;

@Service
public class DocumentService {

  private static final Logger log = LoggerFactory.getLogger(DocumentService.class);

  private final DocumentRepository documentRepository;
  private final CampaignService campaignService;
  private final BookingService bookingService;

  public DocumentService(
      DocumentRepository documentRepository,
      CampaignService campaignService,
      BookingService bookingService) {
    this.documentRepository = documentRepository;
    this.campaignService = campaignService;
    this.bookingService = bookingService;
  }

  @Transactional(readOnly = true)
  public List<Document> listDocuments(
      UUID campaignId, UUID bookingId, DocumentType type, DocumentStatus status) {
    return documentRepository.findByFilters(campaignId, bookingId, type, status);
  }

  @Transactional(readOnly = true)
  public Document getDocument(UUID id) {
    return documentRepository
        .findById(id)
        .orElseThrow(() -> new ResourceNotFoundException("Document", id));
  }

  @Transactional
  public Document createDocument(CreateDocumentRequest request, UUID callerId) {
    if (request.campaignId() != null) {
      campaignService.requireExists("campaignId", request.campaignId());
    }
    if (request.bookingId() != null) {
      bookingService.requireExists("bookingId", request.bookingId());
    }

    var document =
        new Document(
            request.type(),
            request.fileName().trim(),
            request.fileSize(),
            request.mimeType(),
            request.uploadedBy() != null ? request.uploadedBy() : callerId);
    document.attachTo(request.campaignId(), request.bookingId());
    document.geotag(request.gpsLatitude(), request.gpsLongitude(), request.capturedAt());
    if (request.status() != null) {
      document.review(request.status());
    }

    document = documentRepository.save(document);
    log.info(
        "Recorded {} document {} ({} bytes)",
        document.getType().getValue(),
        document.getId(),
        document.getFileSize());
    return document;
  }

  @Transactional
  public Document updateDocument(UUID id, UpdateDocumentRequest request) {
    var document = getDocument(id);

    if (request.campaignId() != null) {
      campaignService.requireExists("campaignId", request.campaignId());
    }
    if (request.bookingId() != null) {
      bookingService.requireExists("bookingId", request.bookingId());
    }
    document.attachTo(
        request.campaignId() != null ? request.campaignId() : document.getCampaignId(),
        request.bookingId() != null ? request.bookingId() : document.getBookingId());

    document.correctMetadata(
        request.type() != null ? request.type() : document.getType(),
        request.fileName() != null ? request.fileName().trim() : document.getFileName(),
        request.fileSize() != null ? request.fileSize() : document.getFileSize(),
        request.mimeType() != null ? request.mimeType() : document.getMimeType());
    document.geotag(
        request.gpsLatitude() != null ? request.gpsLatitude() : document.getGpsLatitude(),
        request.gpsLongitude() != null ? request.gpsLongitude() : document.getGpsLongitude(),
        request.capturedAt() != null ? request.capturedAt() : document.getCapturedAt());

    if (request.status() != null && request.status() != document.getStatus()) {
      log.info("Document {} reviewed: {} -> {}", id, document.getStatus(), request.status());
      document.review(request.status());
    }
    return documentRepository.save(document);
  }

  @Transactional
  public void deleteDocument(UUID id) {
    var document = getDocument(id);
    documentRepository.delete(document);
    log.info("Deleted document {}", id);
  }
}
