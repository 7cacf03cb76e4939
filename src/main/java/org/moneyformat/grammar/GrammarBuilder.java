package org.moneyformat.grammar;

import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;
import org.moneyformat.domain.FormatOptions;
import org.moneyformat.exception.InvalidFormatOptionsException;

/**
 * Synthesizes the regular expression that matches every syntactically valid amount for a set of
 * {@link FormatOptions}.
 *
 * <p>The pattern is assembled inside out; each step wraps or prefixes what the previous steps
 * produced:
 *
 * <ol>
 *   <li>alternation over the accepted fractional digit counts
 *   <li>the literal symbol, optional unless required
 *   <li>the whole amount: {@code 0}, ungrouped digits, or digits grouped by three
 *   <li>the decimal part, appended when decimals are allowed or required
 *   <li>a sign immediately before or after the digits, when configured
 *   <li>at most one spacing modifier: sign placeholder, space after symbol or space after digits
 *   <li>the symbol, before the amount or after it
 *   <li>the parenthesised alternative, or the default leading sign
 *   <li>anchoring
 * </ol>
 *
 * <p>The whole amount is itself optional so that {@code ".03"} is accepted. Strings the pattern
 * cannot exclude without lookaround are rejected beforehand by the guard checks.
 */
@Slf4j
@UtilityClass
public class GrammarBuilder {

  static final String NEGATIVE_SIGN = "-?";
  private static final String WHOLE_AMOUNT_WITHOUT_SEPARATOR = "[1-9]\\d*";

  /**
   * Builds and compiles the grammar for {@code options}.
   *
   * @param options the format to describe
   * @return a pattern that must be used with {@link java.util.regex.Matcher#matches()}
   * @throws InvalidFormatOptionsException if the options cannot describe any grammar
   */
  public static Pattern build(FormatOptions options) {
    String regex = toRegex(options);
    try {
      Pattern pattern = Pattern.compile(regex);
      log.debug("Built currency grammar {}", regex);
      return pattern;
    } catch (PatternSyntaxException e) {
      throw new InvalidFormatOptionsException(
          "Format options produce an invalid grammar: " + regex, e);
    }
  }

  /**
   * Produces the anchored regular expression source for {@code options} without compiling it.
   *
   * @throws InvalidFormatOptionsException if the options cannot describe any grammar
   */
  public static String toRegex(FormatOptions options) {
    Objects.requireNonNull(options, "options MUST NOT be null");
    if (options.symbol() == null) {
      throw new InvalidFormatOptionsException("symbol MUST NOT be null");
    }

    String decimalDigits = decimalDigitsAlternation(options.digitsAfterDecimal());
    String symbol =
        "(?:" + Pattern.quote(options.symbol()) + ")" + (options.requireSymbol() ? "" : "?");

    String groupedWholeAmount =
        "[1-9]\\d{0,2}(?:" + escapeSeparator(options.thousandsSeparator()) + "\\d{3})*";
    String wholeAmount =
        "(?:0|" + WHOLE_AMOUNT_WITHOUT_SEPARATOR + "|" + groupedWholeAmount + ")?";
    String decimalAmount =
        "(?:"
            + escapeSeparator(options.decimalSeparator())
            + "(?:"
            + decimalDigits
            + "))"
            + (options.requireDecimal() ? "" : "?");

    String pattern = wholeAmount;
    if (options.allowDecimal() || options.requireDecimal()) {
      pattern += decimalAmount;
    }

    if (options.allowNegatives() && !options.parensForNegatives()) {
      if (options.negativeSignAfterDigits()) {
        pattern += NEGATIVE_SIGN;
      } else if (options.negativeSignBeforeDigits()) {
        pattern = NEGATIVE_SIGN + pattern;
      }
    }

    if (options.allowNegativeSignPlaceholder()) {
      pattern = "(?: ?-?)?" + pattern;
    } else if (options.allowSpaceAfterSymbol()) {
      pattern = " ?" + pattern;
    } else if (options.allowSpaceAfterDigits()) {
      pattern += " ?";
    }

    if (options.symbolAfterDigits()) {
      pattern += symbol;
    } else {
      pattern = symbol + pattern;
    }

    if (options.allowNegatives()) {
      if (options.parensForNegatives()) {
        pattern = "(?:\\(" + pattern + "\\)|" + pattern + ")";
      } else if (!options.negativeSignBeforeDigits() && !options.negativeSignAfterDigits()) {
        pattern = NEGATIVE_SIGN + pattern;
      }
    }

    return "^" + pattern + "$";
  }

  private static String decimalDigitsAlternation(List<Integer> digitsAfterDecimal) {
    if (digitsAfterDecimal.isEmpty()) {
      throw new InvalidFormatOptionsException("digitsAfterDecimal MUST contain at least one count");
    }
    for (Integer count : digitsAfterDecimal) {
      if (count == null || count < 1) {
        throw new InvalidFormatOptionsException(
            "digitsAfterDecimal MUST contain only positive counts, got " + digitsAfterDecimal);
      }
    }
    return digitsAfterDecimal.stream()
        .map(count -> "\\d{" + count + "}")
        .collect(Collectors.joining("|"));
  }

  /** Letters, digits and underscore are inserted as is; anything else is escaped. */
  static String escapeSeparator(char separator) {
    if (Character.isLetterOrDigit(separator) || separator == '_') {
      return String.valueOf(separator);
    }
    return "\\" + separator;
  }
}
