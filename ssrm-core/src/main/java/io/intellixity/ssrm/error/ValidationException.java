package io.intellixity.ssrm.error;

/** Malformed payload, mistyped field or invalid row window. Raised before any pipeline is built. */
public final class ValidationException extends SsrmException {
  public ValidationException(String message) {
    super(message);
  }

  public ValidationException(String message, Throwable cause) {
    super(message, cause);
  }
}
