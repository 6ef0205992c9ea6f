/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.dfcoef.cli.sdc;


/**
 * Report rendering settings.
 * 
 * @param decimals  number of decimal places (1 thru 15)
 * @param compress  if {@code true}, one line per MO
 * @param debug     if {@code true}, diagnostic lines are printed per MO
 */
public record PrintSettings(int decimals, boolean compress, boolean debug) {
  
  public final static int MIN_DECIMALS = 1;
  public final static int MAX_DECIMALS = 15;
  public final static int DEFAULT_DECIMALS = 5;
  
  public final static PrintSettings DEFAULT = new PrintSettings(DEFAULT_DECIMALS, false, false);
  
  public PrintSettings {
    if (decimals < MIN_DECIMALS || decimals > MAX_DECIMALS)
      throw new IllegalArgumentException(
          "decimals %d out of bounds [%d, %d]".formatted(decimals, MIN_DECIMALS, MAX_DECIMALS));
  }

}
