/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.dfcoef;


import java.util.Objects;

/**
 * An element and the number of its (chemically equivalent) atoms in the molecule.
 * 
 * @param symbol        element symbol (e.g. {@code "Cu"})
 * @param multiplicity  &ge; 1
 */
public record AtomType(String symbol, int multiplicity) {
  
  public AtomType {
    Objects.requireNonNull(symbol, "null symbol");
    if (!Elements.isSymbol(symbol))
      throw new IllegalArgumentException("not an element symbol: " + symbol);
    if (multiplicity < 1)
      throw new IllegalArgumentException("multiplicity " + multiplicity + " < 1");
  }
  
  
  @Override
  public String toString() {
    return multiplicity == 1 ? symbol : symbol + multiplicity;
  }

}
