package org.moneyformat.guard;

import java.util.Arrays;
import java.util.Optional;
import lombok.experimental.UtilityClass;
import org.moneyformat.domain.FormatOptions;

/** Runs every {@link GuardCheck} in declaration order, stopping at the first failure. */
@UtilityClass
public class GuardChecks {

  /**
   * @return the first check {@code text} fails, or empty if it passes them all. A {@code null}
   *     text fails {@link GuardCheck#NOT_EMPTY}.
   */
  public static Optional<GuardCheck> firstFailure(String text, FormatOptions options) {
    if (text == null) {
      return Optional.of(GuardCheck.NOT_EMPTY);
    }
    return Arrays.stream(GuardCheck.values())
        .filter(check -> !check.passes(text, options))
        .findFirst();
  }

  public static boolean passes(String text, FormatOptions options) {
    return firstFailure(text, options).isEmpty();
  }
}
