package org.moneyformat.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.Builder;
import lombok.With;

/**
 * Immutable description of one locale's currency format rules.
 *
 * <p>Every field is independently settable through the generated {@code withX} methods, each of
 * which returns a new instance, or through {@link #toBuilder()}. No validation is performed on
 * construction; combinations that cannot produce a grammar (an empty {@code digitsAfterDecimal},
 * for example) are reported when the grammar is built.
 *
 * <p>Equality is value based, so instances can key the process-wide grammar cache.
 */
@Builder(toBuilder = true)
@With
public record FormatOptions(
    String symbol,
    boolean requireSymbol,
    boolean allowSpaceAfterSymbol,
    boolean symbolAfterDigits,
    boolean allowNegatives,
    boolean parensForNegatives,
    boolean negativeSignBeforeDigits,
    boolean negativeSignAfterDigits,
    boolean allowNegativeSignPlaceholder,
    char thousandsSeparator,
    char decimalSeparator,
    boolean allowDecimal,
    boolean requireDecimal,
    List<Integer> digitsAfterDecimal,
    boolean allowSpaceAfterDigits) {

  private static final FormatOptions DEFAULTS =
      FormatOptions.builder()
          .symbol("$")
          .requireSymbol(false)
          .allowSpaceAfterSymbol(false)
          .symbolAfterDigits(false)
          .allowNegatives(true)
          .parensForNegatives(false)
          .negativeSignBeforeDigits(false)
          .negativeSignAfterDigits(false)
          .allowNegativeSignPlaceholder(false)
          .thousandsSeparator(',')
          .decimalSeparator('.')
          .allowDecimal(true)
          .requireDecimal(false)
          .digitsAfterDecimal(List.of(2))
          .allowSpaceAfterDigits(false)
          .build();

  public FormatOptions {
    // Null elements are kept; the grammar builder reports them as a configuration error.
    digitsAfterDecimal =
        digitsAfterDecimal == null
            ? List.of()
            : Collections.unmodifiableList(new ArrayList<>(digitsAfterDecimal));
  }

  /**
   * US dollar format: symbol "$", optional; comma grouping; dot decimal separator with exactly
   * two fractional digits; negatives shown with a leading sign.
   */
  public static FormatOptions defaults() {
    return DEFAULTS;
  }
}
