package za.gov.ooh.oohbooking.campaign;

import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import za.gov.ooh.oohbooking.campaign.dto.CreateCampaignRequest;
import za.gov.ooh.oohbooking.campaign.dto.UpdateCampaignRequest;
import za.gov.ooh.oohbooking.exception.InvalidRequestException;
import za.gov.ooh.oohbooking.exception.ResourceNotFoundException;

@Service
public class CampaignService {

  private static final Logger log = LoggerFactory.getLogger(CampaignService.class);

  private final CampaignRepository campaignRepository;

  public CampaignService(CampaignRepository campaignRepository) {
    this.campaignRepository = campaignRepository;
  }

  @Transactional(readOnly = true)
  public List<Campaign> listCampaigns(CampaignStatus status, String region) {
    return campaignRepository.findByFilters(status, region);
  }

  @Transactional(readOnly = true)
  public Campaign getCampaign(UUID id) {
    return campaignRepository
        .findById(id)
        .orElseThrow(() -> new ResourceNotFoundException("Campaign", id));
  }

  /**
   * Rejects a reference to a campaign that does not exist.
   *
   * @param field the request field reported in the 400 response
   */
  @Transactional(readOnly = true)
  public void requireExists(String field, UUID campaignId) {
    if (!campaignRepository.existsById(campaignId)) {
      throw new InvalidRequestException(field, "campaign " + campaignId + " does not exist");
    }
  }

  @Transactional
  public Campaign createCampaign(CreateCampaignRequest request, UUID callerId) {
    var campaign =
        new Campaign(
            request.name().trim(),
            request.description(),
            request.createdBy() != null ? request.createdBy() : callerId);
    campaign.updateDetails(
        campaign.getName(), request.description(), request.region(), request.targetReach());
    campaign.plan(request.budget(), request.startDate(), request.endDate());
    if (request.status() != null) {
      campaign.changeStatus(request.status());
    }

    campaign = campaignRepository.save(campaign);
    log.info("Created campaign {} ({})", campaign.getId(), campaign.getName());
    return campaign;
  }

  @Transactional
  public Campaign updateCampaign(UUID id, UpdateCampaignRequest request) {
    var campaign = getCampaign(id);

    campaign.updateDetails(
        request.name() != null ? request.name().trim() : campaign.getName(),
        request.description() != null ? request.description() : campaign.getDescription(),
        request.region() != null ? request.region() : campaign.getRegion(),
        request.targetReach() != null ? request.targetReach() : campaign.getTargetReach());
    campaign.plan(
        request.budget() != null ? request.budget() : campaign.getBudget(),
        request.startDate() != null ? request.startDate() : campaign.getStartDate(),
        request.endDate() != null ? request.endDate() : campaign.getEndDate());

    if (request.status() != null && request.status() != campaign.getStatus()) {
      log.info("Campaign {} status {} -> {}", id, campaign.getStatus(), request.status());
      campaign.changeStatus(request.status());
    }
    return campaignRepository.save(campaign);
  }

  /** Deletes the campaign only. Bookings, documents and invoices that reference it are kept. */
  @Transactional
  public void deleteCampaign(UUID id) {
    var campaign = getCampaign(id);
    campaignRepository.delete(campaign);
    log.info("Deleted campaign {}", id);
  }
}
