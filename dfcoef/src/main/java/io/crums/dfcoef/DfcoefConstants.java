/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.dfcoef;


import java.lang.System.Logger;

/**
 * 
 */
public class DfcoefConstants {

  // never
  private DfcoefConstants() {  }
  
  
  public final static String LOG_NAME = "io.crums.dfcoef";
  
  public static Logger sysLogger() {
    return System.getLogger(LOG_NAME);
  }
  
  
  /** Section start marker: 2nd and 3rd tokens. */
  public final static String VECTOR = "Vector";
  public final static String PRINT = "print";
  
  /** Symmetry header: 1st and 2nd tokens. */
  public final static String FERMION = "Fermion";
  public final static String IRCOP = "ircop";
  
  /** Eigenvalue header: 2nd, 3rd tokens; 4th token contains {@linkplain #NO}. */
  public final static String ELECTRONIC = "Electronic";
  public final static String EIGENVALUE = "eigenvalue";
  public final static String NO = "no.";
  
  /** Section end marker: 2nd and 3rd tokens. */
  public final static String MULLIKEN = "Mulliken";
  public final static String POPULATION = "population";
  
  
  /** Digits after the decimal point in fused legacy number columns. */
  public final static int LEGACY_DECIMALS = 10;
  
  /** Number of trailing amplitude tokens on a coefficient row. */
  public final static int AMPLITUDES = 4;
  
  /** Number of leading tokens (index, component) on a coefficient row. */
  public final static int ROW_PREFIX = 2;
  
  /** Minimum token count of a coefficient row (before reassembly). */
  public final static int MIN_ROW_TOKENS = 5;
  /** Maximum token count of a coefficient row (before reassembly). */
  public final static int MAX_ROW_TOKENS = 9;
  
  
  /** Default percentage threshold below which contributions are not reported. */
  public final static double DEFAULT_THRESHOLD = 0.1;
  
  /**
   * Maximum atom count per element in a molecular formula. Each reported row
   * is repeated this many times, so it is kept small.
   */
  public final static int MAX_MULTIPLICITY = 1000;

}
