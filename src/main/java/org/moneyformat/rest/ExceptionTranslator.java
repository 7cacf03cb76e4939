package org.moneyformat.rest;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import java.net.URI;
import java.time.Instant;
import java.util.Arrays;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.exception.ExceptionUtils;
import org.springframework.context.MessageSourceResolvable;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotAcceptableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Global exception handler that translates exceptions into RFC 7807 Problem Details.
 * A currency text that is not a valid amount is never an error; only malformed requests
 * reach this class.
 */
@RestControllerAdvice
@Slf4j
@RequiredArgsConstructor
@RequestMapping(
    produces = {MediaType.APPLICATION_JSON_VALUE, MediaType.APPLICATION_PROBLEM_JSON_VALUE})
public class ExceptionTranslator {

  private static final String ERROR_BASE_URL = "https://api.example.com/errors/";
  private static final String ERROR_CODE = "errorCode";
  private static final String TIMESTAMP = "timestamp";
  private static final int MAX_STACK_TRACE_LENGTH = 5000; // ~50 lines of stack trace
  private final Environment env;

  /** Handles request body validation errors, one entry per rejected field. */
  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ProblemDetail> handleValidationException(
      MethodArgumentNotValidException ex, HttpServletRequest request) {
    ProblemDetail problemDetail =
        createBaseProblemDetail(HttpStatus.BAD_REQUEST, "Validation Error", ex, request);
    problemDetail.setProperty(
        "errors",
        ex.getBindingResult().getFieldErrors().stream()
            .map(
                error ->
                    Map.of(
                        "field", error.getField(),
                        "rejectedValue", String.valueOf(error.getRejectedValue()),
                        "message",
                            Optional.ofNullable(error.getDefaultMessage()).orElse("No message")))
            .toList());
    return ResponseEntity.badRequest().body(problemDetail);
  }

  /** Handles JSON parsing errors, including unknown format names in the body. */
  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ProblemDetail> handleJsonParseError(
      HttpMessageNotReadableException ex, HttpServletRequest request) {
    ProblemDetail problemDetail =
        createBaseProblemDetail(HttpStatus.BAD_REQUEST, "Malformed JSON", ex, request);
    String errorDetail =
        Optional.ofNullable(ex.getMostSpecificCause())
            .map(cause -> "JSON parsing error: " + cause.getMessage())
            .orElse("Malformed JSON input: " + ex.getMessage());

    problemDetail.setDetail(errorDetail);
    return ResponseEntity.badRequest().body(problemDetail);
  }

  @ExceptionHandler(ConstraintViolationException.class)
  public ResponseEntity<ProblemDetail> handleConstraintViolation(
      ConstraintViolationException ex, HttpServletRequest request) {
    return buildErrorResponse(HttpStatus.BAD_REQUEST, "Constraint Violation", ex, request);
  }

  /** Handles precondition failures raised by the service layer, such as oversized text. */
  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ProblemDetail> handleIllegalArgument(
      IllegalArgumentException ex, HttpServletRequest request) {
    return buildErrorResponse(HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT", ex, request);
  }

  @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
  public ResponseEntity<ProblemDetail> handleMethodNotSupported(
      HttpRequestMethodNotSupportedException ex, HttpServletRequest request) {
    return buildErrorResponse(HttpStatus.METHOD_NOT_ALLOWED, "METHOD_NOT_ALLOWED", ex, request);
  }

  @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
  public ResponseEntity<ProblemDetail> handleMediaTypeNotSupported(
      HttpMediaTypeNotSupportedException ex, HttpServletRequest request) {
    return buildErrorResponse(
        HttpStatus.UNSUPPORTED_MEDIA_TYPE, "UNSUPPORTED_MEDIA_TYPE", ex, request);
  }

  @ExceptionHandler(HttpMediaTypeNotAcceptableException.class)
  public ResponseEntity<ProblemDetail> handleMediaTypeNotAccepted(
      HttpMediaTypeNotAcceptableException ex, HttpServletRequest request) {
    return buildErrorResponse(HttpStatus.NOT_ACCEPTABLE, "NOT_ACCEPTABLE", ex, request);
  }

  /** Handles missing required request parameters and specifies which parameter was missing. */
  @ExceptionHandler(MissingServletRequestParameterException.class)
  public ResponseEntity<ProblemDetail> handleMissingParams(
      MissingServletRequestParameterException ex, HttpServletRequest request) {
    ProblemDetail problemDetail =
        createBaseProblemDetail(HttpStatus.BAD_REQUEST, "Missing Parameter", ex, request);
    problemDetail.setProperty("parameter", ex.getParameterName());
    problemDetail.setProperty("parameterType", ex.getParameterType());
    return ResponseEntity.badRequest().body(problemDetail);
  }

  /** Handles constraint violations on query parameters. */
  @ExceptionHandler(HandlerMethodValidationException.class)
  public ResponseEntity<ProblemDetail> handleMethodValidation(
      HandlerMethodValidationException ex, HttpServletRequest request) {
    ProblemDetail problemDetail =
        createBaseProblemDetail(HttpStatus.BAD_REQUEST, "Method Validation Error", ex, request);
    problemDetail.setProperty(
        "validationErrors",
        ex.getParameterValidationResults().stream()
            .map(
                result ->
                    Map.of(
                        "parameter",
                            Optional.ofNullable(result.getMethodParameter().getParameterName())
                                .orElse("unknown"),
                        "messages",
                            result.getResolvableErrors().stream()
                                .map(MessageSourceResolvable::getDefaultMessage)
                                .filter(Objects::nonNull)
                                .toList()))
            .toList());
    return ResponseEntity.badRequest().body(problemDetail);
  }

  /** Handles request parameters of the wrong type, such as an unknown currency format name. */
  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  public ResponseEntity<ProblemDetail> handleTypeMismatch(
      MethodArgumentTypeMismatchException ex, HttpServletRequest request) {
    ProblemDetail problemDetail =
        createBaseProblemDetail(HttpStatus.BAD_REQUEST, "Invalid Parameter", ex, request);

    Class<?> requiredType = ex.getRequiredType();
    problemDetail.setProperty("parameter", ex.getName());
    problemDetail.setProperty(
        "expectedType", requiredType != null ? requiredType.getSimpleName() : "Unknown");
    problemDetail.setProperty("invalidValue", ex.getValue());
    if (requiredType != null && requiredType.isEnum()) {
      problemDetail.setProperty(
          "allowedValues",
          Arrays.stream(requiredType.getEnumConstants()).map(Object::toString).toList());
    }

    return ResponseEntity.badRequest().body(problemDetail);
  }

  /**
   * Catch-all handler for all other exceptions not defined in this @ControllerAdvice, returning a
   * 500 Internal Server Error.
   */
  @ExceptionHandler(Exception.class)
  public ResponseEntity<ProblemDetail> handleUnexpectedException(
      Exception ex, HttpServletRequest request) {
    log.error("Unexpected error occurred", ex);
    return buildErrorResponse(
        HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred", ex, request);
  }

  private ResponseEntity<ProblemDetail> buildErrorResponse(
      HttpStatus status, String title, Exception ex, HttpServletRequest request) {
    ProblemDetail problemDetail = createBaseProblemDetail(status, title, ex, request);
    return ResponseEntity.status(status).body(problemDetail);
  }

  /** Creates the ProblemDetail object with standard properties like status, timestamp, etc. */
  private ProblemDetail createBaseProblemDetail(
      HttpStatus status, String title, Exception ex, HttpServletRequest request) {
    log.debug("Translating {} into {} response", ex.getClass().getSimpleName(), status.value());
    ProblemDetail problemDetail = ProblemDetail.forStatus(status);
    problemDetail.setTitle(title);
    problemDetail.setDetail(ex.getMessage());
    problemDetail.setType(URI.create(ERROR_BASE_URL + status.value()));
    problemDetail.setInstance(URI.create(request.getRequestURI()));
    problemDetail.setProperty(ERROR_CODE, title.toUpperCase().replace(" ", "_"));
    problemDetail.setProperty(TIMESTAMP, Instant.now());

    addDebugInfo(problemDetail, ex);
    addRequestMetadata(problemDetail, request);

    return problemDetail;
  }

  /** Adds the exception class and a truncated stack trace in the dev profile. */
  private void addDebugInfo(ProblemDetail detail, Exception ex) {
    if (env.acceptsProfiles(Profiles.of("dev"))) {
      detail.setProperty("exception", ex.getClass().getName());
      String fullStackTrace = ExceptionUtils.getStackTrace(ex);
      String truncatedStackTrace =
          fullStackTrace.length() > MAX_STACK_TRACE_LENGTH
              ? fullStackTrace.substring(0, MAX_STACK_TRACE_LENGTH) + "..."
              : fullStackTrace;
      detail.setProperty("stackTrace", truncatedStackTrace);
    }
  }

  private void addRequestMetadata(ProblemDetail detail, HttpServletRequest request) {
    detail.setProperty(
        "request",
        Map.of(
            "httpMethod", Optional.ofNullable(request.getMethod()).orElse(""),
            "requestId", Optional.ofNullable(request.getHeader("X-Request-Id")).orElse("")));
  }
}
