/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.dfcoef;


/**
 * Thrown when no molecular formula is given.
 */
@SuppressWarnings("serial")
public class MissingMoleculeSpecException extends DfcoefException {

  public MissingMoleculeSpecException() {
    super("missing molecule specification (e.g. Cu2O)");
  }

}
