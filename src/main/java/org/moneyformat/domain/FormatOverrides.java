package org.moneyformat.domain;

import jakarta.validation.constraints.Size;
import java.util.List;
import java.util.Optional;
import lombok.Builder;

/**
 * A partial set of {@link FormatOptions} fields. A {@code null} component leaves the
 * corresponding option of the base format untouched. Symbol and digit-count sizes are bounded
 * for request binding.
 */
@Builder
public record FormatOverrides(
    @Size(max = FormatOverrides.MAX_SYMBOL_LENGTH) String symbol,
    Boolean requireSymbol,
    Boolean allowSpaceAfterSymbol,
    Boolean symbolAfterDigits,
    Boolean allowNegatives,
    Boolean parensForNegatives,
    Boolean negativeSignBeforeDigits,
    Boolean negativeSignAfterDigits,
    Boolean allowNegativeSignPlaceholder,
    Character thousandsSeparator,
    Character decimalSeparator,
    Boolean allowDecimal,
    Boolean requireDecimal,
    @Size(max = FormatOverrides.MAX_DECIMAL_ALTERNATIVES) List<Integer> digitsAfterDecimal,
    Boolean allowSpaceAfterDigits) {

  public static final int MAX_SYMBOL_LENGTH = 8;
  public static final int MAX_DECIMAL_ALTERNATIVES = 8;

  public static FormatOverrides none() {
    return FormatOverrides.builder().build();
  }

  /** Whether {@code overrides} would change anything when applied. */
  public static boolean changesAnything(FormatOverrides overrides) {
    return overrides != null && !none().equals(overrides);
  }

  /**
   * @param base the options to start from
   * @return a new options value with every non-null override applied
   */
  public FormatOptions applyTo(FormatOptions base) {
    FormatOptions.FormatOptionsBuilder builder = base.toBuilder();
    Optional.ofNullable(symbol).ifPresent(builder::symbol);
    Optional.ofNullable(requireSymbol).ifPresent(builder::requireSymbol);
    Optional.ofNullable(allowSpaceAfterSymbol).ifPresent(builder::allowSpaceAfterSymbol);
    Optional.ofNullable(symbolAfterDigits).ifPresent(builder::symbolAfterDigits);
    Optional.ofNullable(allowNegatives).ifPresent(builder::allowNegatives);
    Optional.ofNullable(parensForNegatives).ifPresent(builder::parensForNegatives);
    Optional.ofNullable(negativeSignBeforeDigits).ifPresent(builder::negativeSignBeforeDigits);
    Optional.ofNullable(negativeSignAfterDigits).ifPresent(builder::negativeSignAfterDigits);
    Optional.ofNullable(allowNegativeSignPlaceholder)
        .ifPresent(builder::allowNegativeSignPlaceholder);
    Optional.ofNullable(thousandsSeparator).ifPresent(builder::thousandsSeparator);
    Optional.ofNullable(decimalSeparator).ifPresent(builder::decimalSeparator);
    Optional.ofNullable(allowDecimal).ifPresent(builder::allowDecimal);
    Optional.ofNullable(requireDecimal).ifPresent(builder::requireDecimal);
    Optional.ofNullable(digitsAfterDecimal).ifPresent(builder::digitsAfterDecimal);
    Optional.ofNullable(allowSpaceAfterDigits).ifPresent(builder::allowSpaceAfterDigits);
    return builder.build();
  }
}
