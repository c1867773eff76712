package dev.fragmenter.splitting;

/** Thrown when the value handed to {@link ContentSplitter} is not a string. */
public class InvalidInputTypeException extends IllegalArgumentException {

  public InvalidInputTypeException(String message) {
    super(message);
  }
}
