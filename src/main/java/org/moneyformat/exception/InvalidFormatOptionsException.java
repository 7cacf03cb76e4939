package org.moneyformat.exception;

/**
 * Thrown when a set of format options cannot be turned into a matching grammar, for example
 * when no fractional digit count is configured.
 * Never reaches callers of the currency validator, which report such formats as non-matching.
 */
public class InvalidFormatOptionsException extends RuntimeException {

  /**
   * @param message The error message.
   */
  public InvalidFormatOptionsException(String message) {
    super(message);
  }

  /**
   * @param message The error message.
   * @param cause   The underlying cause of the exception.
   */
  public InvalidFormatOptionsException(String message, Throwable cause) {
    super(message, cause);
  }
}
