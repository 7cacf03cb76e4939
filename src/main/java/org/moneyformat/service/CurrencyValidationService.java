package org.moneyformat.service;

import java.util.Arrays;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.moneyformat.config.CurrencyValidationProperties;
import org.moneyformat.domain.CurrencyFormat;
import org.moneyformat.domain.FormatOptions;
import org.moneyformat.domain.FormatOverrides;
import org.moneyformat.rest.CurrencyFormatResponse;
import org.moneyformat.rest.CurrencyValidationResponse;
import org.moneyformat.validation.CurrencyValidator;
import org.springframework.stereotype.Service;

/**
 * Service layer for currency amount validation.
 * Resolves the requested format, applies option overrides and delegates to
 * {@link CurrencyValidator}. Only preset options use the process-wide grammar cache;
 * caller-supplied overrides get a grammar built for the single request.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CurrencyValidationService {

  private final CurrencyValidationProperties properties;

  /**
   * Validate a candidate amount.
   *
   * @param text The text to validate
   * @param format The preset to validate against, or null for the configured default
   * @param overrides Options replacing those of the preset, may be null
   * @return The validation outcome
   * @throws IllegalArgumentException if the text is null or longer than the configured maximum
   */
  public CurrencyValidationResponse validate(
      String text, CurrencyFormat format, FormatOverrides overrides) {
    validateText(text);
    CurrencyFormat effectiveFormat = format == null ? properties.defaultFormat() : format;
    FormatOptions options = resolveOptions(effectiveFormat, overrides);

    boolean useCache = properties.cacheGrammars() && !FormatOverrides.changesAnything(overrides);
    boolean valid = CurrencyValidator.isCurrency(text, options, useCache);
    log.info("Validated currency text against {}: valid={}", effectiveFormat, valid);
    log.debug("Text '{}' checked with options {}", text, options);
    return new CurrencyValidationResponse(text, effectiveFormat, valid);
  }

  /**
   * List every supported preset with the options it expands to.
   */
  public List<CurrencyFormatResponse> listFormats() {
    return Arrays.stream(CurrencyFormat.values())
        .map(format -> new CurrencyFormatResponse(format, format.options()))
        .toList();
  }

  private FormatOptions resolveOptions(CurrencyFormat format, FormatOverrides overrides) {
    FormatOptions base = format.options();
    return FormatOverrides.changesAnything(overrides) ? overrides.applyTo(base) : base;
  }

  private void validateText(String text) {
    if (text == null) {
      throw new IllegalArgumentException("text is required");
    }
    if (text.length() > properties.maxTextLength()) {
      throw new IllegalArgumentException(
          "text exceeds maximum length of " + properties.maxTextLength() + " characters");
    }
  }
}
