package za.gov.ooh.oohbooking.campaign;

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
import za.gov.ooh.oohbooking.campaign.dto.CampaignResponse;
import za.gov.ooh.oohbooking.campaign.dto.CreateCampaignRequest;
import za.gov.ooh.oohbooking.campaign.dto.UpdateCampaignRequest;
import za.gov.ooh.oohbooking.security.CurrentUser;

@RestController
@RequestMapping("/api/campaigns")
public class CampaignController {

  private final CampaignService campaignService;

  public CampaignController(CampaignService campaignService) {
    this.campaignService = campaignService;
  }

  @GetMapping
  public ResponseEntity<List<CampaignResponse>> listCampaigns(
      @RequestParam(required = false) CampaignStatus status,
      @RequestParam(required = false) String region) {
    var campaigns =
        campaignService.listCampaigns(status, region).stream()
            .map(CampaignResponse::from)
            .toList();
    return ResponseEntity.ok(campaigns);
  }

  @GetMapping("/{id}")
  public ResponseEntity<CampaignResponse> getCampaign(@PathVariable UUID id) {
    return ResponseEntity.ok(CampaignResponse.from(campaignService.getCampaign(id)));
  }

  @PostMapping
  public ResponseEntity<CampaignResponse> createCampaign(
      @Valid @RequestBody CreateCampaignRequest request) {
    var campaign = campaignService.createCampaign(request, CurrentUser.requireId());
    return ResponseEntity.created(URI.create("/api/campaigns/" + campaign.getId()))
        .body(CampaignResponse.from(campaign));
  }

  @PatchMapping("/{id}")
  public ResponseEntity<CampaignResponse> updateCampaign(
      @PathVariable UUID id, @Valid @RequestBody UpdateCampaignRequest request) {
    return ResponseEntity.ok(CampaignResponse.from(campaignService.updateCampaign(id, request)));
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<Void> deleteCampaign(@PathVariable UUID id) {
    campaignService.deleteCampaign(id);
    return ResponseEntity.noContent().build();
  }
}
