package org.moneyformat.rest;

import static org.moneyformat.rest.ApiConstants.ApiPath.BASE_V1_API_PATH;
import static org.moneyformat.rest.ApiConstants.ApiPath.FORMATS;
import static org.moneyformat.rest.ApiConstants.ApiPath.VALIDATIONS;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import org.moneyformat.domain.CurrencyFormat;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;

@Tag(
    name = "Currency Validation",
    description = "Endpoints for checking currency amount strings against locale formats.")
@RequestMapping(
    value = BASE_V1_API_PATH,
    produces = {MediaType.APPLICATION_JSON_VALUE, MediaType.APPLICATION_PROBLEM_JSON_VALUE})
public interface CurrencyValidationAPI {

  @Operation(summary = "Validate a currency amount with an optional format and option overrides")
  @ApiResponses(
      value = {
        @ApiResponse(responseCode = "200", description = "Validation performed"),
        @ApiResponse(responseCode = "400", description = "Invalid validation request"),
        @ApiResponse(responseCode = "500", description = "Internal server error")
      })
  @PostMapping(value = VALIDATIONS, consumes = MediaType.APPLICATION_JSON_VALUE)
  ResponseEntity<CurrencyValidationResponse> validate(
      @Valid @RequestBody CurrencyValidationRequest request);

  @Operation(summary = "Validate a currency amount against a named format")
  @ApiResponses(
      value = {
        @ApiResponse(responseCode = "200", description = "Validation performed"),
        @ApiResponse(responseCode = "400", description = "Missing text or unknown format")
      })
  @GetMapping(value = VALIDATIONS)
  ResponseEntity<CurrencyValidationResponse> validateText(
      @RequestParam @NotNull String text,
      @RequestParam(required = false) CurrencyFormat format);

  @Operation(summary = "List the supported currency formats")
  @ApiResponses({@ApiResponse(responseCode = "200", description = "Supported formats")})
  @GetMapping(value = FORMATS)
  ResponseEntity<List<CurrencyFormatResponse>> getFormats();
}
