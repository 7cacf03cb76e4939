package org.moneyformat.domain;

import java.util.function.UnaryOperator;

/** Named locale presets for {@link FormatOptions}. */
public enum CurrencyFormat {
  US_DOLLAR(options -> options),
  US_DOLLAR_NO_NEGATIVES(options -> options.withAllowNegatives(false)),
  US_DOLLAR_ACCOUNTING(options -> options.withParensForNegatives(true)),
  CHINESE_YUAN(options -> options.withSymbol("¥").withNegativeSignBeforeDigits(true)),
  SOUTH_AFRICAN_RAND(
      options ->
          options.toBuilder()
              .symbol("R")
              .negativeSignBeforeDigits(true)
              .thousandsSeparator(' ')
              .decimalSeparator(',')
              .allowNegativeSignPlaceholder(true)
              .build()),
  EURO_ITALIAN(
      options ->
          options.toBuilder()
              .symbol("€")
              .thousandsSeparator('.')
              .decimalSeparator(',')
              .allowSpaceAfterSymbol(true)
              .build()),
  EURO_GREEK(
      options ->
          options.toBuilder()
              .symbol("€")
              .thousandsSeparator('.')
              .decimalSeparator(',')
              .symbolAfterDigits(true)
              .allowSpaceAfterDigits(true)
              .build()),
  DANISH_KRONE(
      options ->
          options.toBuilder()
              .symbol("kr.")
              .negativeSignBeforeDigits(true)
              .thousandsSeparator('.')
              .decimalSeparator(',')
              .allowSpaceAfterSymbol(true)
              .build()),
  BRAZILIAN_REAL(
      options ->
          options.toBuilder()
              .symbol("R$")
              .requireSymbol(true)
              .allowSpaceAfterSymbol(true)
              .thousandsSeparator('.')
              .decimalSeparator(',')
              .build());

  private final FormatOptions options;

  CurrencyFormat(UnaryOperator<FormatOptions> customizer) {
    this.options = customizer.apply(FormatOptions.defaults());
  }

  public FormatOptions options() {
    return options;
  }
}
