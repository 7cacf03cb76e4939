package org.moneyformat.validation;

import java.util.Optional;
import java.util.regex.Pattern;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;
import org.moneyformat.domain.FormatOptions;
import org.moneyformat.exception.InvalidFormatOptionsException;
import org.moneyformat.grammar.GrammarBuilder;
import org.moneyformat.grammar.GrammarCache;
import org.moneyformat.guard.GuardCheck;
import org.moneyformat.guard.GuardChecks;

/**
 * Decides whether a piece of text is a syntactically valid monetary amount for a given format.
 *
 * <p>Validation runs the guard checks first, then matches the whole text against the grammar
 * built for the options. Every failure, including options that cannot produce a grammar, is
 * reported as {@code false}; nothing is thrown to the caller. Results depend only on the text and
 * the options.
 */
@Slf4j
@UtilityClass
public class CurrencyValidator {

  /** Validates {@code text} against the US dollar format of {@link FormatOptions#defaults()}. */
  public static boolean isCurrency(String text) {
    return isCurrency(text, null);
  }

  /**
   * @param text the candidate amount
   * @param options the format to validate against; {@code null} selects the defaults
   * @return {@code true} if the whole text is a valid amount for the format
   */
  public static boolean isCurrency(String text, FormatOptions options) {
    return isCurrency(text, options, true);
  }

  /**
   * @param useCache whether to reuse grammars from the process-wide {@link GrammarCache}
   */
  public static boolean isCurrency(String text, FormatOptions options, boolean useCache) {
    FormatOptions effective = options == null ? FormatOptions.defaults() : options;

    Optional<GuardCheck> failed = GuardChecks.firstFailure(text, effective);
    if (failed.isPresent()) {
      log.debug("Rejected '{}' by guard check {}", text, failed.get());
      return false;
    }

    Pattern grammar;
    try {
      grammar = useCache ? GrammarCache.get(effective) : GrammarBuilder.build(effective);
    } catch (InvalidFormatOptionsException e) {
      log.warn("Cannot build currency grammar for {}: {}", effective, e.getMessage());
      return false;
    }

    boolean matches = grammar.matcher(text).matches();
    if (!matches) {
      log.debug("Rejected '{}': does not match grammar {}", text, grammar.pattern());
    }
    return matches;
  }
}
