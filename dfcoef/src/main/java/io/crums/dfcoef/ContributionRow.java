/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.dfcoef;


import java.util.Objects;

/**
 * One atom-orbital's share of an MO.
 * 
 * @param atom        element symbol
 * @param orbital     orbital type (e.g. {@code "dyz"})
 * @param percentage  percent of the MO attributed to one atom of this type
 */
public record ContributionRow(String atom, String orbital, double percentage) {
  
  public ContributionRow {
    Objects.requireNonNull(atom, "null atom");
    Objects.requireNonNull(orbital, "null orbital");
  }
  
  
  /** Returns the display label, e.g. {@code "Cl_dyz"}. */
  public String label() {
    return atom + "_" + orbital;
  }

}
