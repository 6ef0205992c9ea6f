/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.dfcoef;


/**
 * {@linkplain PrivecScanner} states.
 */
public enum ScanState {
  
  /** Before the "Vector print" line. */
  WAITING_FOR_SECTION_START,
  /** Inside the section, between MO blocks. */
  WAITING_FOR_EIGENVALUE_HEADER,
  /** Inside an MO block (after its "Electronic eigenvalue no." line). */
  READING_COEFFICIENTS,
  /** After the "Mulliken population" line. No more lines are consumed. */
  TERMINATED;

}
