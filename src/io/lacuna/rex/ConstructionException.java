package io.lacuna.rex;

/**
 * Raised when a postfix sequence that breaks the converter's guarantees reaches the NFA builder. This is a bug in
 * the caller, not a problem with the pattern.
 */
public class ConstructionException extends IllegalStateException {

  private static final long serialVersionUID = -6144937218447011850L;

  public ConstructionException(String message) {
    super(message);
  }
}
