/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.dfcoef;


/**
 * Thrown when an "Electronic eigenvalue no." line carries an index or
 * energy that does not parse.
 */
@SuppressWarnings("serial")
public class InvalidEigenvalueHeaderException extends DfcoefException {
  
  private final String line;

  public InvalidEigenvalueHeaderException(String line, Throwable cause) {
    super("malformed eigenvalue header: " + line.strip(), cause);
    this.line = line;
  }
  
  
  public final String getLine() {
    return line;
  }

}
