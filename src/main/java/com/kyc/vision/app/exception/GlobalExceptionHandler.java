package com.kyc.vision.app.exception;

import com.kyc.vision.app.model.ErrorEnvelope;
import jakarta.servlet.http.HttpServletRequest;
import java.util.UUID;
import lombok.extern.log4j.Log4j2;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

/** Maps service exceptions onto {@link ErrorEnvelope} responses. */
@Log4j2
@RestControllerAdvice
public class GlobalExceptionHandler {

  @ExceptionHandler(InvalidSourceException.class)
  public ResponseEntity<ErrorEnvelope> handleInvalidSource(
      InvalidSourceException ex, HttpServletRequest request) {
    String errorId = generateErrorId();
    log.warn(
        "api.error.source id={} path={} code={} msg={}",
        errorId,
        request.getRequestURI(),
        ex.getCode(),
        ex.getMessage());
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(ErrorEnvelope.of(ex.getCode(), ex.getMessage()));
  }

  @ExceptionHandler(MaxUploadSizeExceededException.class)
  public ResponseEntity<ErrorEnvelope> handleMaxUpload(
      MaxUploadSizeExceededException ex, HttpServletRequest request) {
    String errorId = generateErrorId();
    log.warn(
        "api.error.upload id={} path={} msg={}", errorId, request.getRequestURI(), ex.getMessage());
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(
            ErrorEnvelope.of(
                InvalidSourceException.FILE_TOO_LARGE,
                "Upload exceeds the configured size limit"));
  }

  @ExceptionHandler(ModelInferenceException.class)
  public ResponseEntity<ErrorEnvelope> handleModel(
      ModelInferenceException ex, HttpServletRequest request) {
    String errorId = generateErrorId();
    log.error(
        "api.error.model id={} path={} msg={}",
        errorId,
        request.getRequestURI(),
        ex.getMessage(),
        ex);
    return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
        .body(
            ErrorEnvelope.of(
                ModelInferenceException.CODE, "Vision model call failed [" + errorId + "]"));
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ErrorEnvelope> handleGeneric(Exception ex, HttpServletRequest request) {
    String errorId = generateErrorId();
    if (ex instanceof ErrorResponse framework && framework.getStatusCode().is4xxClientError()) {
      // Spring MVC binding / media type problems keep their own status.
      log.warn(
          "api.error.request id={} path={} status={} msg={}",
          errorId,
          request.getRequestURI(),
          framework.getStatusCode().value(),
          ex.getMessage());
      return ResponseEntity.status(framework.getStatusCode())
          .body(ErrorEnvelope.of("bad_request", ex.getMessage()));
    }
    log.error(
        "api.error.internal id={} path={} msg={}",
        errorId,
        request.getRequestURI(),
        ex.getMessage(),
        ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(ErrorEnvelope.of("internal_error", "Unexpected error [" + errorId + "]"));
  }

  private static String generateErrorId() {
    return UUID.randomUUID().toString().substring(0, 8);
  }
}
