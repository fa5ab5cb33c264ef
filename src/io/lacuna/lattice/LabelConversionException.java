package io.lacuna.lattice;

/**
 * Thrown when a label can't be turned into an integer emission code.
 */
public class LabelConversionException extends RuntimeException {
  public LabelConversionException(String message) {
    super(message);
  }
}
