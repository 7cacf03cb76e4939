package org.moneyformat.unit;


import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import java.lang.reflect.Method;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.moneyformat.domain.CurrencyFormat;
import org.moneyformat.rest.CurrencyValidationRequest;
import org.moneyformat.rest.ExceptionTranslator;
import org.springframework.context.support.DefaultMessageSourceResolvable;
import org.springframework.core.MethodParameter;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.BindingResult;
import org.springframework.validation.FieldError;
import org.springframework.web.HttpMediaTypeNotAcceptableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.validation.method.ParameterValidationResult;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Tests for ExceptionTranslator's RFC 7807 Problem Detail responses
 */
@ExtendWith(MockitoExtension.class)
class ExceptionTranslatorUnitTest {

  @Mock private Environment env;
  @Mock private HttpServletRequest request;
  @Mock private BindingResult bindingResult;
  @Mock private MethodParameter methodParameter;

  private ExceptionTranslator exceptionTranslator;

  @BeforeEach
  void setUp() {
    exceptionTranslator = new ExceptionTranslator(env);

    // Complete request mock setup to avoid NPE
    lenient().when(request.getMethod()).thenReturn("POST");
    lenient().when(request.getRequestURI()).thenReturn("/api/v1/currency/validations");
    lenient().when(request.getHeader("X-Request-Id")).thenReturn("test-123");
  }

  @Test
  void handleIllegalArgument_ShouldReturn400() {
    // given
    IllegalArgumentException ex =
        new IllegalArgumentException("text exceeds maximum length of 256 characters");

    // when
    ResponseEntity<ProblemDetail> response = exceptionTranslator.handleIllegalArgument(ex, request);

    // then
    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody().getTitle()).isEqualTo("INVALID_ARGUMENT");
    assertThat(response.getBody().getDetail()).contains("maximum length");
    assertThat(response.getBody().getProperties()).containsEntry("errorCode", "INVALID_ARGUMENT");
    assertThat(response.getBody().getProperties().get("request"))
        .isEqualTo(Map.of("httpMethod", "POST", "requestId", "test-123"));
  }

  @Test
  void handleMethodValidation_ShouldListParameterMessages() {
    // given
    HandlerMethodValidationException ex = mock(HandlerMethodValidationException.class);
    ParameterValidationResult result = mock(ParameterValidationResult.class);
    when(methodParameter.getParameterName()).thenReturn("text");
    when(result.getMethodParameter()).thenReturn(methodParameter);
    when(result.getResolvableErrors())
        .thenReturn(
            List.of(
                new DefaultMessageSourceResolvable(
                    new String[] {"NotNull"}, "must not be null")));
    when(ex.getParameterValidationResults()).thenReturn(List.of(result));

    // when
    ResponseEntity<ProblemDetail> response = exceptionTranslator.handleMethodValidation(ex, request);

    // then
    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody().getTitle()).isEqualTo("Method Validation Error");
    assertThat(response.getBody().getProperties().get("validationErrors"))
        .isEqualTo(List.of(Map.of("parameter", "text", "messages", List.of("must not be null"))));
  }

  @Test
  void handleMethodArgumentNotValid_ShouldReturn400() {
    // given
    Method dummyMethod = ExceptionTranslator.class.getDeclaredMethods()[0]; // get any method from the class
    lenient().when(methodParameter.getParameterType()).thenReturn((Class) CurrencyValidationRequest.class);
    lenient().when(methodParameter.getExecutable()).thenReturn(dummyMethod);
    lenient().when(methodParameter.getParameterName()).thenReturn("request");

    FieldError fieldError = new FieldError(
        "currencyValidationRequest", "text", null, false,
        new String[]{"NotNull"}, null, "text is required"
    );
    lenient().when(bindingResult.getFieldErrors()).thenReturn(List.of(fieldError));
    MethodArgumentNotValidException ex = new MethodArgumentNotValidException(methodParameter, bindingResult);

    // when
    ResponseEntity<ProblemDetail> response = exceptionTranslator.handleValidationException(ex, request);

    // then
    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody().getTitle()).isEqualTo("Validation Error");
    assertThat(response.getBody().getStatus()).isEqualTo(400);
    @SuppressWarnings("unchecked")
    List<Map<String, String>> errors =
        (List<Map<String, String>>) response.getBody().getProperties().get("errors");
    assertThat(errors).singleElement().satisfies(error -> {
      assertThat(error).containsEntry("field", "text");
      assertThat(error).containsEntry("rejectedValue", "null");
      assertThat(error).containsEntry("message", "text is required");
    });
  }

  @Test
  void handleConstraintViolation_ShouldReturn400() {
    // given
    ConstraintViolationException ex = new ConstraintViolationException("text: must not be null", Set.of());

    // when
    ResponseEntity<ProblemDetail> response = exceptionTranslator.handleConstraintViolation(ex, request);

    // then
    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody().getTitle()).isEqualTo("Constraint Violation");
  }

  @Test
  void handleHttpMediaTypeNotSupported_ShouldReturn415() {
    // given
    HttpMediaTypeNotSupportedException ex = new HttpMediaTypeNotSupportedException(
        MediaType.APPLICATION_XML,
        List.of(MediaType.APPLICATION_JSON)
    );

    // when
    ResponseEntity<ProblemDetail> response = exceptionTranslator.handleMediaTypeNotSupported(ex, request);

    // then
    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNSUPPORTED_MEDIA_TYPE);
    assertThat(response.getBody().getTitle()).isEqualTo("UNSUPPORTED_MEDIA_TYPE");
    assertThat(response.getBody().getStatus()).isEqualTo(415);
  }

  @Test
  void handleHttpMediaTypeNotAcceptable_ShouldReturn406() {
    // given
    HttpMediaTypeNotAcceptableException ex = new HttpMediaTypeNotAcceptableException(
        List.of(MediaType.APPLICATION_JSON)
    );

    // when
    ResponseEntity<ProblemDetail> response = exceptionTranslator.handleMediaTypeNotAccepted(ex, request);

    // then
    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_ACCEPTABLE);
    assertThat(response.getBody().getTitle()).isEqualTo("NOT_ACCEPTABLE");
    assertThat(response.getBody().getStatus()).isEqualTo(406);
  }

  @Test
  void handleHttpRequestMethodNotSupported_ShouldReturn405() {
    // given
    HttpRequestMethodNotSupportedException ex = new HttpRequestMethodNotSupportedException(
        "DELETE",
        List.of("GET", "POST")
    );

    // when
    ResponseEntity<ProblemDetail> response = exceptionTranslator.handleMethodNotSupported(ex, request);

    // then
    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.METHOD_NOT_ALLOWED);
    assertThat(response.getBody().getTitle()).isEqualTo("METHOD_NOT_ALLOWED");
    assertThat(response.getBody().getStatus()).isEqualTo(405);
  }

  @Test
  void handleMissingServletRequestParameter_ShouldReturn400() {
    // given
    MissingServletRequestParameterException ex = new MissingServletRequestParameterException(
        "text",
        "String"
    );

    // when
    ResponseEntity<ProblemDetail> response = exceptionTranslator.handleMissingParams(ex, request);

    // then
    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody().getTitle()).isEqualTo("Missing Parameter");
    assertThat(response.getBody().getProperties().get("parameter")).isEqualTo("text");
    assertThat(response.getBody().getProperties().get("parameterType")).isEqualTo("String");
  }

  @Test
  void handleMethodArgumentTypeMismatch_ShouldListAllowedFormats() {
    // given
    MethodArgumentTypeMismatchException ex = new MethodArgumentTypeMismatchException(
        "DOGECOIN",
        CurrencyFormat.class,
        "format",
        methodParameter,
        new IllegalArgumentException("No enum constant")
    );

    // when
    ResponseEntity<ProblemDetail> response = exceptionTranslator.handleTypeMismatch(ex, request);

    // then
    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody().getTitle()).isEqualTo("Invalid Parameter");
    assertThat(response.getBody().getProperties().get("parameter")).isEqualTo("format");
    assertThat(response.getBody().getProperties().get("expectedType")).isEqualTo("CurrencyFormat");
    assertThat(response.getBody().getProperties().get("invalidValue")).isEqualTo("DOGECOIN");
    assertThat(response.getBody().getProperties().get("allowedValues"))
        .asInstanceOf(InstanceOfAssertFactories.LIST)
        .hasSize(CurrencyFormat.values().length)
        .contains("US_DOLLAR", "DANISH_KRONE");
  }

  @Test
  void handleHttpMessageNotReadable_ShouldReturn400() {
    // given
    HttpMessageNotReadableException ex = new HttpMessageNotReadableException("Malformed JSON", null, null);

    // when
    ResponseEntity<ProblemDetail> response = exceptionTranslator.handleJsonParseError(ex, request);

    // then
    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody().getTitle()).isEqualTo("Malformed JSON");
    assertThat(response.getBody().getDetail()).startsWith("JSON parsing error");
  }

  @Test
  void handleGenericException_ShouldReturn500() {
    // given
    Exception ex = new RuntimeException("Unexpected error");

    // when
    ResponseEntity<ProblemDetail> response = exceptionTranslator.handleUnexpectedException(ex, request);

    // then
    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    assertThat(response.getBody().getTitle()).isEqualTo("An unexpected error occurred");
    assertThat(response.getBody().getProperties()).doesNotContainKey("stackTrace");
  }

  @Test
  void devProfile_ShouldIncludeStackTrace() {
    // given
    when(env.acceptsProfiles(any(Profiles.class))).thenReturn(true);
    Exception ex = new IllegalStateException("boom");

    // when
    ResponseEntity<ProblemDetail> response = exceptionTranslator.handleUnexpectedException(ex, request);

    // then
    assertThat(response.getBody().getProperties())
        .containsEntry("exception", IllegalStateException.class.getName())
        .containsKey("stackTrace");
  }
}
