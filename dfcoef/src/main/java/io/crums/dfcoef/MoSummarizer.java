/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.dfcoef;


import java.util.ArrayList;
import java.util.Comparator;

/**
 * Converts an MO block's {@linkplain Accumulation} into percentage contributions.
 * 
 * <h2>Equivalent Atoms</h2>
 * <p>
 * A label's weighted sum covers all atoms of its type. Its percentage is
 * computed per atom (divided by the multiplicity) and, if it makes the
 * threshold, the row is repeated once for each atom of the type. Inequivalent
 * atoms of the same element are thus not told apart.
 * </p>
 */
public class MoSummarizer {
  
  private final static Comparator<ContributionRow> LARGEST_FIRST =
      Comparator.comparingDouble(ContributionRow::percentage).reversed();
  
  private final double threshold;
  private final boolean debug;
  
  
  public MoSummarizer(ScanConfig config) {
    this(config.threshold(), config.debug());
  }
  
  /**
   * @param threshold   minimum percentage reported
   * @param debug       if {@code true}, diagnostics are recorded in results
   */
  public MoSummarizer(double threshold, boolean debug) {
    this.threshold = threshold;
    this.debug = debug;
  }
  
  
  /**
   * Summarizes the given block.
   * 
   * @param symmetry    symmetry label
   * @param electronNo  eigenvalue no.
   * @param energy      orbital energy
   * @param sums        the block's accumulated sums
   */
  public MoResult summarize(String symmetry, int electronNo, double energy, Accumulation sums) {
    
    final double total = sums.total();
    var rows = new ArrayList<ContributionRow>();
    double unweightedSum = 0;
    
    for (var entry : sums.entries()) {
      int m = entry.multiplicity();
      unweightedSum += entry.sum() / m;
      if (total == 0)
        continue;
      
      double percentage = entry.sum() * 100 / (total * m);
      if (percentage < threshold)
        continue;
      
      var row = new ContributionRow(entry.label().atom(), entry.label().orbital(), percentage);
      for (int count = m; count-- > 0; )
        rows.add(row);
    }
    
    rows.sort(LARGEST_FIRST);   // (stable)
    
    if (!debug)
      return new MoResult(symmetry, electronNo, energy, rows);
    
    double coefficientSum = total == 0 ? 0 : unweightedSum / total;
    return new MoResult(symmetry, electronNo, energy, rows, total, coefficientSum);
  }

}
