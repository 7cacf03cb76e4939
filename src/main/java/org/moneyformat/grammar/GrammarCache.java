package org.moneyformat.grammar;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;
import org.moneyformat.domain.FormatOptions;

/**
 * Process-wide memoization of built grammars, keyed by options equality. Entries are created on
 * first use and never replaced. Options that fail to build are not cached, so the failure is
 * reported again on every lookup.
 */
@Slf4j
@UtilityClass
public class GrammarCache {

  private static final Map<FormatOptions, Pattern> GRAMMARS = new ConcurrentHashMap<>();

  /**
   * @throws org.moneyformat.exception.InvalidFormatOptionsException if the options cannot
   *     describe any grammar
   */
  public static Pattern get(FormatOptions options) {
    Pattern cached = GRAMMARS.get(options);
    if (cached != null) {
      return cached;
    }
    return GRAMMARS.computeIfAbsent(options, GrammarBuilder::build);
  }

  public static int size() {
    return GRAMMARS.size();
  }

  /** Drops every cached grammar. */
  public static void clear() {
    log.debug("Clearing {} cached currency grammars", GRAMMARS.size());
    GRAMMARS.clear();
  }
}
