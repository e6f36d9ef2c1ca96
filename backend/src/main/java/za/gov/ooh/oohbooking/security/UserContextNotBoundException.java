package za.gov.ooh.oohbooking.security;

/**
 * Thrown when code that requires a caller runs outside an authenticated request. Indicates a
 * security configuration error, not a client error.
 */
public class UserContextNotBoundException extends IllegalStateException {

  public UserContextNotBoundException() {
    super("No authenticated user bound to the current request");
  }
}
