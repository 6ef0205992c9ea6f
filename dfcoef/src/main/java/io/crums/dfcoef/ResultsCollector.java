/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.dfcoef;


import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Collects {@linkplain MoResult}s in scan order and, on {@linkplain #finish()},
 * optionally orders them by orbital energy.
 */
public class ResultsCollector {
  
  private final static Comparator<MoResult> BY_ENERGY =
      Comparator.comparingDouble(MoResult::energy);
  
  private final List<MoResult> results = new ArrayList<>();
  private final boolean sortByEnergy;
  
  private boolean finished;
  
  
  /**
   * @param sortByEnergy  if {@code true}, {@linkplain #finish()} sorts by energy (ascending)
   */
  public ResultsCollector(boolean sortByEnergy) {
    this.sortByEnergy = sortByEnergy;
  }
  
  
  /**
   * Appends the given result.
   * 
   * @throws IllegalStateException if already {@linkplain #finish() finish}ed
   */
  public void add(MoResult result) {
    if (finished)
      throw new IllegalStateException("already finished");
    results.add(result);
  }
  
  
  /** Returns the number of results collected. */
  public int size() {
    return results.size();
  }
  
  
  /**
   * Sorts the results (if so configured) the first time invoked, and
   * returns them. Idempotent.
   * 
   * @return read-only list
   */
  public List<MoResult> finish() {
    if (!finished) {
      finished = true;
      if (sortByEnergy)
        results.sort(BY_ENERGY);
    }
    return Collections.unmodifiableList(results);
  }
  
  
  public boolean isFinished() {
    return finished;
  }

}
