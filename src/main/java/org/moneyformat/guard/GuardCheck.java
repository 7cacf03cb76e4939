package org.moneyformat.guard;

import java.util.function.BiPredicate;
import org.apache.commons.lang3.StringUtils;
import org.moneyformat.domain.FormatOptions;

/**
 * Procedural pre-checks that reject strings the synthesized grammar cannot exclude on its own.
 * Constants are declared in evaluation order; each predicate answers whether the text passes.
 */
public enum GuardCheck {
  NOT_EMPTY((text, options) -> !text.isEmpty()),

  NO_SURROUNDING_SPACE((text, options) -> !text.startsWith(" ") && !text.endsWith(" ")),

  NO_SPACE_AFTER_SIGN((text, options) -> !text.contains("- ")),

  HAS_DIGIT((text, options) -> text.chars().anyMatch(c -> c >= '0' && c <= '9')),

  /** Space after the symbol, unless allowed outright or through the sign placeholder. */
  NO_SPACE_AFTER_SYMBOL(
      (text, options) ->
          options.allowSpaceAfterSymbol()
              || options.allowNegativeSignPlaceholder()
              || !text.contains(options.symbol() + " ")),

  /** The placeholder space may stand in for a sign but not precede one. */
  NO_PLACEHOLDER_BEFORE_SIGN(
      (text, options) ->
          !options.allowNegativeSignPlaceholder()
              || options.allowSpaceAfterSymbol()
              || !text.contains(options.symbol() + " -")),

  /** Amount followed by a bare space, ignoring one trailing symbol and one closing parenthesis. */
  NO_SPACE_AFTER_DIGITS(
      (text, options) -> {
        if (options.allowSpaceAfterDigits() || options.allowNegativeSignPlaceholder()) {
          return true;
        }
        String trimmed = StringUtils.removeEnd(StringUtils.removeEnd(text, options.symbol()), ")");
        return !trimmed.endsWith(" ");
      });

  private final BiPredicate<String, FormatOptions> check;

  GuardCheck(BiPredicate<String, FormatOptions> check) {
    this.check = check;
  }

  /**
   * @param text non-null candidate text
   * @param options the format being validated against
   * @return {@code true} if the text passes this check
   */
  public boolean passes(String text, FormatOptions options) {
    return check.test(text, options);
  }
}
