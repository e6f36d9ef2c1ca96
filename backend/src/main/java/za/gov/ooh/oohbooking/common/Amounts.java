package za.gov.ooh.oohbooking.common;

import java.math.BigDecimal;

/** Money travels over the wire as plain decimal strings, never as JSON numbers. */
public final class Amounts {

  public static String format(BigDecimal amount) {
    return amount != null ? amount.toPlainString() : null;
  }

  /** Like {@link #format} but renders a missing amount as {@code "0"}. */
  public static String formatOrZero(BigDecimal amount) {
    return amount != null ? amount.toPlainString() : "0";
  }

  private Amounts() {}
}
