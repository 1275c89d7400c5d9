package com.waterly.store.error;

/**
 * Input rejected before any write. {@link #field()} names the offending field or setting key.
 */
public class ValidationException extends IllegalArgumentException {
  private final String field;

  public ValidationException(String field, String message) {
    super(field + ": " + message);
    this.field = field;
  }

  public ValidationException(String field, String message, Throwable cause) {
    super(field + ": " + message, cause);
    this.field = field;
  }

  public String field() {
    return field;
  }

  public static String requireText(String field, String value) {
    if (value == null || value.isBlank()) {
      throw new ValidationException(field, "must not be blank");
    }
    return value;
  }

  public static <T> T requirePresent(String field, T value) {
    if (value == null) {
      throw new ValidationException(field, "is required");
    }
    return value;
  }
}
