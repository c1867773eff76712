package dev.fragmenter.splitting;

/**
 * Thrown when the source could not be classified as HTML or plain text. The failure raised while
 * probing the source is kept as the cause.
 */
public class InvalidInputFormatException extends IllegalArgumentException {

  public InvalidInputFormatException(String message, Throwable cause) {
    super(message, cause);
  }
}
