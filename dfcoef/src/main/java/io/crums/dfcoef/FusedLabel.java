/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.dfcoef;


import java.util.Objects;

/**
 * The decoded label of a coefficient row.
 * 
 * @param symmetry  symmetry (irreducible representation) label, e.g. {@code "B3g"}
 * @param atom      element symbol, e.g. {@code "Cl"}
 * @param orbital   orbital type without its principal quantum number, e.g. {@code "dyz"}
 * 
 * @see LabelResolver
 */
public record FusedLabel(String symmetry, String atom, String orbital) {
  
  public FusedLabel {
    Objects.requireNonNull(symmetry, "null symmetry");
    Objects.requireNonNull(atom, "null atom");
    Objects.requireNonNull(orbital, "null orbital");
  }
  
  
  /**
   * Returns the composite key under which coefficients are summed:
   * symmetry, atom, and orbital concatenated.
   */
  public String key() {
    return symmetry + atom + orbital;
  }

}
