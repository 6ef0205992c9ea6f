/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.dfcoef;


/**
 * Thrown when a molecular formula contains something other than an element
 * symbol followed by an optional count.
 */
@SuppressWarnings("serial")
public class InvalidElementSymbolException extends DfcoefException {
  
  private final String formula;
  private final String segment;

  /**
   * @param formula   the whole formula
   * @param segment   the offending part of it
   */
  public InvalidElementSymbolException(String formula, String segment) {
    super("invalid element symbol '%s' in molecule '%s'".formatted(segment, formula));
    this.formula = formula;
    this.segment = segment;
  }
  
  
  public final String getFormula() {
    return formula;
  }
  
  
  public final String getSegment() {
    return segment;
  }

}
