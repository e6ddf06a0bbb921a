package io.intellixity.ssrm.error;

/** The database accepted the connection but failed to execute the aggregation command. */
public final class DriverException extends SsrmException {
  public DriverException(String message, Throwable cause) {
    super(message, cause);
  }
}
