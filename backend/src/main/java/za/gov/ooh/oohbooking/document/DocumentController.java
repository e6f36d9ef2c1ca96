package za.gov.ooh.oohbooking.document;

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
import za.gov.ooh.oohbooking.document.dto.CreateDocumentRequest;
import za.gov.ooh.oohbooking.document.dto.DocumentResponse;
import za.gov.ooh.oohbooking.document.dto.UpdateDocumentRequest;
import za.gov.ooh.oohbooking.security.CurrentUser;

@RestController
@RequestMapping("/api/documents")
public class DocumentController {

  private final DocumentService documentService;

  public DocumentController(DocumentService documentService) {
    this.documentService = documentService;
  }

  @GetMapping
  public ResponseEntity<List<DocumentResponse>> listDocuments(
      @RequestParam(required = false) UUID campaignId,
      @RequestParam(required = false) UUID bookingId,
      @RequestParam(required = false) DocumentType type,
      @RequestParam(required = false) DocumentStatus status) {
    var documents =
        documentService.listDocuments(campaignId, bookingId, type, status).stream()
            .map(DocumentResponse::from)
            .toList();
    return ResponseEntity.ok(documents);
  }

  @GetMapping("/{id}")
  public ResponseEntity<DocumentResponse> getDocument(@PathVariable UUID id) {
    return ResponseEntity.ok(DocumentResponse.from(documentService.getDocument(id)));
  }

  @PostMapping
  public ResponseEntity<DocumentResponse> createDocument(
      @Valid @RequestBody CreateDocumentRequest request) {
    var document = documentService.createDocument(request, CurrentUser.requireId());
    return ResponseEntity.created(URI.create("/api/documents/" + document.getId()))
        .body(DocumentResponse.from(document));
  }

  @PatchMapping("/{id}")
  public ResponseEntity<DocumentResponse> updateDocument(
      @PathVariable UUID id, @Valid @RequestBody UpdateDocumentRequest request) {
    return ResponseEntity.ok(DocumentResponse.from(documentService.updateDocument(id, request)));
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<Void> deleteDocument(@PathVariable UUID id) {
    documentService.deleteDocument(id);
    return ResponseEntity.noContent().build();
  }
}
