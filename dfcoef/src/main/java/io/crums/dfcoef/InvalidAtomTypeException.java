/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.dfcoef;


/**
 * Thrown when the fused symmetry/atom/orbital text of a coefficient row
 * does not decode to a known element.
 */
@SuppressWarnings("serial")
public class InvalidAtomTypeException extends DfcoefException {
  
  private final String text;

  public InvalidAtomTypeException(String text) {
    super("cannot resolve atom type from '%s'".formatted(text));
    this.text = text;
  }
  
  
  /** Returns the offending text. */
  public final String getText() {
    return text;
  }

}
