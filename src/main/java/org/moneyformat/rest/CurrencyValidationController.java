package org.moneyformat.rest;

import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.moneyformat.domain.CurrencyFormat;
import org.moneyformat.service.CurrencyValidationService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller implementation for currency amount validation.
 * An invalid amount is a successful response with {@code valid=false}; only malformed
 * requests produce error responses.
 */
@RestController
@Slf4j
@RequiredArgsConstructor
public class CurrencyValidationController implements CurrencyValidationAPI {

  private final CurrencyValidationService validationService;

  @Override
  public ResponseEntity<CurrencyValidationResponse> validate(CurrencyValidationRequest request) {
    log.debug("REST request to validate currency text: {}", request);
    return ResponseEntity.ok(
        validationService.validate(request.text(), request.format(), request.overrides()));
  }

  @Override
  public ResponseEntity<CurrencyValidationResponse> validateText(
      String text, CurrencyFormat format) {
    log.debug("REST request to validate currency text '{}' as {}", text, format);
    return ResponseEntity.ok(validationService.validate(text, format, null));
  }

  @Override
  public ResponseEntity<List<CurrencyFormatResponse>> getFormats() {
    log.debug("REST request to list currency formats");
    return ResponseEntity.ok(validationService.listFormats());
  }
}
