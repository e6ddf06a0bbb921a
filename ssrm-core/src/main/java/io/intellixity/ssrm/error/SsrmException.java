package io.intellixity.ssrm.error;

/**
 * Base type for every failure the SSRM engine reports.
 * <p>
 * Each subtype maps to exactly one outcome at the boundary; nothing below the boundary recovers from these.
 */
public class SsrmException extends RuntimeException {
  public SsrmException(String message) {
    super(message);
  }

  public SsrmException(String message, Throwable cause) {
    super(message, cause);
  }
}
