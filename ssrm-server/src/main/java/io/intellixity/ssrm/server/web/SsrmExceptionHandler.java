package io.intellixity.ssrm.server.web;

import io.intellixity.ssrm.error.SsrmException;
import io.intellixity.ssrm.error.UnsupportedFeatureException;
import io.intellixity.ssrm.error.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/** Maps engine failures to status codes with a {@code {"error": message}} body. */
@RestControllerAdvice
public final class SsrmExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(SsrmExceptionHandler.class);
  static final String UNKNOWN_ERROR = "Unknown SSRM error";

  @ExceptionHandler(ValidationException.class)
  public ResponseEntity<Map<String, String>> validation(ValidationException e) {
    log.debug("ssrm.http status=400 error={}", e.getMessage());
    return body(HttpStatus.BAD_REQUEST, e);
  }

  @ExceptionHandler(UnsupportedFeatureException.class)
  public ResponseEntity<Map<String, String>> unsupported(UnsupportedFeatureException e) {
    log.debug("ssrm.http status=501 feature={}", e.feature());
    return body(HttpStatus.NOT_IMPLEMENTED, e);
  }

  @ExceptionHandler(SsrmException.class)
  public ResponseEntity<Map<String, String>> engine(SsrmException e) {
    log.warn("ssrm.http status=500 error={}", e.getMessage(), e);
    return body(HttpStatus.INTERNAL_SERVER_ERROR, e);
  }

  /** Spring MVC failures (wrong method, unknown path, ...) keep their own status. */
  @ExceptionHandler(Exception.class)
  public ResponseEntity<Map<String, String>> unexpected(Exception e) {
    if (e instanceof ErrorResponse er) {
      log.debug("ssrm.http status={} error={}", er.getStatusCode().value(), e.getMessage());
      return ResponseEntity.status(er.getStatusCode()).headers(er.getHeaders()).body(Map.of("error", message(e)));
    }
    log.error("ssrm.http status=500 unexpected", e);
    return body(HttpStatus.INTERNAL_SERVER_ERROR, e);
  }

  private static ResponseEntity<Map<String, String>> body(HttpStatus status, Exception e) {
    return ResponseEntity.status(status).body(Map.of("error", message(e)));
  }

  private static String message(Exception e) {
    return (e.getMessage() == null || e.getMessage().isBlank()) ? UNKNOWN_ERROR : e.getMessage();
  }
}
