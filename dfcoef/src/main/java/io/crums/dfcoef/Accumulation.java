/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.dfcoef;


import java.lang.System.Logger.Level;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Weighted sums of squared coefficients for a single MO block. Each
 * coefficient row's magnitude (the sum of the squares of its amplitudes) is
 * weighted by the multiplicity of its atom and added both to the grand total
 * and to its label's running sum. Labels are remembered in the order first
 * seen.
 * <p>
 * Instances are not thread-safe. A new one is used for every MO block.
 * </p>
 */
public class Accumulation {
  
  /**
   * A label's running sum.
   */
  public final static class Entry {
    
    private final FusedLabel label;
    private final int multiplicity;
    private double sum;
    
    private Entry(FusedLabel label, int multiplicity) {
      this.label = label;
      this.multiplicity = multiplicity;
    }
    
    public FusedLabel label() {
      return label;
    }
    
    /** Multiplicity of the label's atom (also the weight applied). */
    public int multiplicity() {
      return multiplicity;
    }
    
    /** Returns the weighted sum. */
    public double sum() {
      return sum;
    }
    
    @Override
    public String toString() {
      return label.key() + "=" + sum;
    }
  }
  
  
  private final AtomSpec atoms;
  private final Map<String, Entry> entries = new LinkedHashMap<>();
  private double total;
  
  
  public Accumulation(AtomSpec atoms) {
    this.atoms = Objects.requireNonNull(atoms, "null atoms");
  }
  
  
  /**
   * Adds a coefficient row.
   * 
   * @param label       the row's decoded label
   * @param amplitudes  the row's amplitude tokens (real and imaginary parts);
   *                    tokens that do not parse count as zero
   *                    
   * @return the weighted magnitude added
   * @throws AtomNotInMoleculeSpecException if the label's atom is not in the molecule
   */
  public double add(FusedLabel label, List<String> amplitudes) {
    double magnitude = 0;
    for (var token : amplitudes) {
      double value = parseOrZero(token);
      magnitude += value * value;
    }
    return addMagnitude(label, magnitude);
  }
  
  
  /**
   * Adds the (unweighted) magnitude of a coefficient row.
   * 
   * @return the weighted magnitude added
   */
  public double addMagnitude(FusedLabel label, double magnitude) {
    int multiplicity = atoms.multiplicity(label.atom());
    double weighted = magnitude * multiplicity;
    total += weighted;
    entries.computeIfAbsent(
        label.key(), k -> new Entry(label, multiplicity)).sum += weighted;
    return weighted;
  }
  
  
  /**
   * Parses the given amplitude token. Stray markers in the log (anything that
   * is not a number) count as zero.
   */
  static double parseOrZero(String token) {
    try {
      return Double.parseDouble(token);
    } catch (NumberFormatException nfx) {
      DfcoefConstants.sysLogger().log(
          Level.TRACE, "non-numeric amplitude counted as 0: " + token);
      return 0;
    }
  }
  
  
  /** Returns the sum of all weighted magnitudes (the normalization constant). */
  public double total() {
    return total;
  }
  
  
  /** Returns the label sums in the order the labels were first seen. */
  public List<Entry> entries() {
    return Collections.unmodifiableList(new ArrayList<>(entries.values()));
  }
  
  
  @Override
  public String toString() {
    return getClass().getSimpleName() + "[total=" + total + ",entries=" + entries.values() + "]";
  }

}
