/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.dfcoef;


/**
 * Scan and summary settings.
 * 
 * @param threshold     minimum percentage reported (&ge; 0)
 * @param debug         if {@code true}, diagnostics are kept with every result
 * @param sortByEnergy  if {@code true}, results are ordered by orbital energy (ascending);
 *                      otherwise, in the order they occur in the log
 * 
 * @see #DEFAULT
 */
public record ScanConfig(double threshold, boolean debug, boolean sortByEnergy) {
  
  /** Threshold 0.1%, no diagnostics, sorted. */
  public final static ScanConfig DEFAULT =
      new ScanConfig(DfcoefConstants.DEFAULT_THRESHOLD, false, true);
  
  public ScanConfig {
    if (!(threshold >= 0))
      throw new IllegalArgumentException("threshold: " + threshold);
  }
  
  
  /** Returns a possibly mutated version. */
  public ScanConfig sortByEnergy(boolean sort) {
    return sort == this.sortByEnergy ? this : new ScanConfig(threshold, debug, sort);
  }

}
