/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.dfcoef;


/**
 * Base exception in the <code>dfcoef</code> module. All are fatal: they
 * indicate the molecule description or the log does not match what the
 * scanner expects.
 */
@SuppressWarnings("serial")
public class DfcoefException extends RuntimeException {

  public DfcoefException(String message) {
    super(message);
  }

  public DfcoefException(String message, Throwable cause) {
    super(message, cause);
  }

}
