/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.dfcoef;


/**
 * Thrown when an element occurs more than once in a molecular formula.
 * (Write {@code Cu2O}, not {@code CuOCu}.)
 */
@SuppressWarnings("serial")
public class DuplicateAtomTypeException extends DfcoefException {
  
  private final String symbol;

  public DuplicateAtomTypeException(String formula, String symbol) {
    super("atom type '%s' occurs more than once in molecule '%s'".formatted(symbol, formula));
    this.symbol = symbol;
  }
  
  
  public final String getSymbol() {
    return symbol;
  }

}
