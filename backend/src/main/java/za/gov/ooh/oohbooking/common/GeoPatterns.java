package za.gov.ooh.oohbooking.common;

/** Decimal-degree patterns used on request records that carry GPS coordinates. */
public final class GeoPatterns {

  public static final String LATITUDE = "^-?(90(\\.0+)?|[1-8]?\\d(\\.\\d+)?)$";
  public static final String LONGITUDE = "^-?(180(\\.0+)?|(1[0-7]\\d|[1-9]?\\d)(\\.\\d+)?)$";

  public static final String LATITUDE_MESSAGE = "must be a decimal latitude between -90 and 90";
  public static final String LONGITUDE_MESSAGE = "must be a decimal longitude between -180 and 180";

  private GeoPatterns() {}
}
