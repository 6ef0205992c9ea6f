/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.dfcoef;


/**
 * Thrown when the log references an atom the molecular formula does not
 * contain. Usually means the formula given does not describe the log.
 */
@SuppressWarnings("serial")
public class AtomNotInMoleculeSpecException extends DfcoefException {
  
  private final String symbol;

  public AtomNotInMoleculeSpecException(String symbol, AtomSpec spec) {
    super(
        "atom '%s' found in the log is not in the molecule specification %s"
        .formatted(symbol, spec));
    this.symbol = symbol;
  }
  
  
  public final String getSymbol() {
    return symbol;
  }

}
