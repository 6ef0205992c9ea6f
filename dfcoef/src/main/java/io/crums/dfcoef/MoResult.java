/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.dfcoef;


import java.util.List;
import java.util.Objects;

/**
 * Summary of one molecular orbital.
 * 
 * @param symmetry        symmetry label (from the preceding "Fermion ircop" line)
 * @param electronNo      electronic eigenvalue no.
 * @param energy          orbital energy
 * @param rows            contributions, largest first
 * @param normConstant    grand total of weighted magnitudes (zero, unless debugging)
 * @param coefficientSum  sum of the unweighted label sums over the grand total
 *                        (zero, unless debugging)
 */
public record MoResult(
    String symmetry,
    int electronNo,
    double energy,
    List<ContributionRow> rows,
    double normConstant,
    double coefficientSum) {
  
  public MoResult {
    Objects.requireNonNull(symmetry, "null symmetry");
    rows = List.copyOf(rows);
  }
  
  
  /** Creates an instance with no diagnostics. */
  public MoResult(String symmetry, int electronNo, double energy, List<ContributionRow> rows) {
    this(symmetry, electronNo, energy, rows, 0, 0);
  }

}
