package za.gov.ooh.oohbooking.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.format.FormatterRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;
import za.gov.ooh.oohbooking.booking.BookingStatus;
import za.gov.ooh.oohbooking.campaign.CampaignStatus;
import za.gov.ooh.oohbooking.document.DocumentStatus;
import za.gov.ooh.oohbooking.document.DocumentType;
import za.gov.ooh.oohbooking.inventory.InventoryStatus;
import za.gov.ooh.oohbooking.invoice.InvoiceStatus;
import za.gov.ooh.oohbooking.security.Role;

/**
 * Query parameters carry enum values in their lower-case wire form ({@code ?status=in_progress}),
 * so each enum is bound through its own {@code from} lookup rather than {@code Enum.valueOf}.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

  @Override
  public void addFormatters(FormatterRegistry registry) {
    registry.addConverter(String.class, Role.class, Role::from);
    registry.addConverter(String.class, CampaignStatus.class, CampaignStatus::from);
    registry.addConverter(String.class, BookingStatus.class, BookingStatus::from);
    registry.addConverter(String.class, DocumentType.class, DocumentType::from);
    registry.addConverter(String.class, DocumentStatus.class, DocumentStatus::from);
    registry.addConverter(String.class, InvoiceStatus.class, InvoiceStatus::from);
    registry.addConverter(String.class, InventoryStatus.class, InventoryStatus::from);
  }
}
