package io.intellixity.ssrm.error;

/** The database client could not be obtained or the server could not be reached. */
public final class ConnectivityException extends SsrmException {
  public ConnectivityException(String message) {
    super(message);
  }

  public ConnectivityException(String message, Throwable cause) {
    super(message, cause);
  }
}
