package za.gov.ooh.oohbooking.client;

/**
 * Raised when the server rejects the stored session. By the time it is thrown the session and every
 * cached read have already been discarded, so the caller only needs to return to its sign-in
 * screen.
 */
public class SessionExpiredException extends RuntimeException {

  public SessionExpiredException(String message) {
    super(message);
  }
}
