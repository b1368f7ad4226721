package cafe.woden.cui.web;

import cafe.woden.cui.config.api.SettingsStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Maps settings failures onto HTTP responses with a {@code {code, message}} body. */
@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  public record ApiError(String code, String message) {}

  @ExceptionHandler(SettingsStoreException.class)
  public ResponseEntity<ApiError> settingsFailure(SettingsStoreException e) {
    HttpStatus status =
        switch (e.kind()) {
          case NOT_INITIALIZED -> HttpStatus.SERVICE_UNAVAILABLE;
          case READ_FAILED, WRITE_FAILED -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    if (e.kind() != SettingsStoreException.ErrorKind.NOT_INITIALIZED) {
      log.warn("[cui] Settings request failed: {}", e.getMessage(), e.getCause());
    }
    return ResponseEntity.status(status).body(new ApiError("SETTINGS_" + e.kind().name(), e.getMessage()));
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiError> unreadableBody(HttpMessageNotReadableException e) {
    return ResponseEntity.badRequest()
        .body(new ApiError("INVALID_REQUEST_BODY", "Request body is not a valid settings update"));
  }
}
