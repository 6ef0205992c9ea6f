/*
 * Copyright 2026 Babak Farhang
 */
/**
 * Summarizes the molecular orbital (MO) coefficients printed in the
 * vector-print (PRIVEC) section of a DIRAC output log.
 * <p>
 * For each MO, the squared amplitudes of its coefficient rows are summed per
 * symmetry / atom / orbital-type label, weighted by the number of atoms of that
 * type in the molecule ({@linkplain io.crums.dfcoef.AtomSpec}). The sums are
 * then normalized to percentages, filtered by a threshold, and ranked
 * ({@linkplain io.crums.dfcoef.MoSummarizer}).
 * </p><p>
 * The processing model is a single pass over the lines of the log, driven by
 * the {@linkplain io.crums.dfcoef.PrivecScanner} state machine, which pulls
 * lines lazily from a {@code Stream<String>}. For files, see
 * {@linkplain io.crums.dfcoef.PrivecLogParser}.
 * </p>
 */
package io.crums.dfcoef;
