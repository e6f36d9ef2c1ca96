package za.gov.ooh.oohbooking.exception;

/** A single rejected request field, rendered in the {@code errors} property of a 400 response. */
public record FieldViolation(String field, String message) {}
