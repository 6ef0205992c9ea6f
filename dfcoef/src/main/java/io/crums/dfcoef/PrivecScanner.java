/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.dfcoef;

import static io.crums.dfcoef.DfcoefConstants.*;

import java.lang.System.Logger.Level;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * State machine that scans the vector-print (PRIVEC) section of a DIRAC log,
 * one line at a time. The section looks something like this:
 * <pre>
 *  *** Vector print ***
 *
 *   Fermion ircop B3g
 *
 *  * Electronic eigenvalue no. 22: -2.8417809384721
 *  ====================================================
 *      1  L B3gCl 3dyz   0.5000000000  0.5000000000 -0.5000000000  0.5000000000
 *      2  L B3gO  2pz    0.0100000000-0.0100000000  0.0000000000  0.0000000000
 *
 *  * Electronic eigenvalue no. 23: ...
 *  ...
 *  ** Mulliken population analysis **
 * </pre>
 * <p>
 * Each MO block is closed by a blank line, at which point it is
 * {@linkplain MoSummarizer summarized} and {@linkplain ResultsCollector collected}.
 * A block still open when the section ends (or the input ends) is dropped.
 * </p>
 * <h2>Single Thread Access</h2>
 * <p>
 * Instances are stateful and not thread-safe.
 * </p>
 * 
 * @see #accept(String)
 * @see #scan(Stream)
 */
public class PrivecScanner {
  
  private final LabelResolver labels;
  private final MoSummarizer summarizer;
  private final ResultsCollector collector;
  
  private ScanState state = ScanState.WAITING_FOR_SECTION_START;
  
  private String symmetry = "";
  private int electronNo;
  private double energy;
  private Accumulation sums;
  
  private long lineNo;
  
  
  /**
   * @param atoms   the molecule
   * @param config  threshold, diagnostics, and ordering settings
   */
  public PrivecScanner(AtomSpec atoms, ScanConfig config) {
    Objects.requireNonNull(config, "null config");
    this.labels = new LabelResolver(atoms);
    this.summarizer = new MoSummarizer(config);
    this.collector = new ResultsCollector(config.sortByEnergy());
  }
  
  
  /** Returns the current state. */
  public ScanState state() {
    return state;
  }
  
  
  /** Returns the number of lines accepted so far. */
  public long lineNo() {
    return lineNo;
  }
  
  
  /** Returns the number of MO results collected so far. */
  public int resultCount() {
    return collector.size();
  }
  
  
  /**
   * Scans the given lines until either the section ends or the lines run out,
   * and returns the {@linkplain #finish() finish}ed results. Lines are pulled
   * lazily: the rest of the stream is not consumed once the section ends.
   */
  public List<MoResult> scan(Stream<String> lines) {
    var iter = lines.iterator();
    while (iter.hasNext() && accept(iter.next()));
    return finish();
  }
  
  
  /**
   * Ends the scan and returns the results. An MO block still open is
   * dropped.
   * 
   * @return read-only list, ordered by energy if so configured
   */
  public List<MoResult> finish() {
    if (state == ScanState.READING_COEFFICIENTS)
      dropOpenBlock("end of input");
    if (!collector.isFinished())
      sysLogger().log(
          Level.DEBUG, "%d MO results collected from %d lines"
          .formatted(collector.size(), lineNo));
    return collector.finish();
  }
  
  
  /**
   * Consumes the next line of the log.
   * 
   * @param line    without its EOL
   * 
   * @return {@code false} once the section has ended (the remaining lines
   *         need not be scanned); {@code true} otherwise
   *         
   * @throws InvalidAtomTypeException if a coefficient row's label does not decode
   * @throws AtomNotInMoleculeSpecException if a coefficient row names an atom
   *         not in the molecule
   * @throws InvalidEigenvalueHeaderException if an eigenvalue line is malformed
   */
  public boolean accept(String line) {
    if (state == ScanState.TERMINATED)
      return false;
    ++lineNo;
    
    var tokens = RowTokenizer.INSTANCE.apply(line);
    
    if (state == ScanState.WAITING_FOR_SECTION_START) {
      if (tokenPairAt(tokens, 1, VECTOR, PRINT)) {
        sysLogger().log(Level.DEBUG, "vector print section found at line " + lineNo);
        state = ScanState.WAITING_FOR_EIGENVALUE_HEADER;
      }
      return true;
    }
    
    if (tokens.size() >= 5 && tokenPairAt(tokens, 1, MULLIKEN, POPULATION)) {
      terminate();
      return false;
    }
    
    switch (state) {
    case WAITING_FOR_EIGENVALUE_HEADER:
      readHeader(line, tokens);
      break;
    case READING_COEFFICIENTS:
      readCoefficients(tokens);
      break;
    default:
      throw new IllegalStateException("unexpected state " + state);
    }
    return true;
  }
  
  
  private void terminate() {
    if (state == ScanState.READING_COEFFICIENTS)
      dropOpenBlock("section end (line %d)".formatted(lineNo));
    sysLogger().log(Level.DEBUG, "vector print section ended at line " + lineNo);
    state = ScanState.TERMINATED;
  }
  
  
  private void dropOpenBlock(String reason) {
    sysLogger().log(
        Level.DEBUG,
        "MO block %s no. %d not closed by a blank line before %s; dropped"
        .formatted(symmetry, electronNo, reason));
    sums = null;
    state = ScanState.WAITING_FOR_EIGENVALUE_HEADER;
  }
  
  
  private void readHeader(String line, List<String> tokens) {
    
    if (tokens.size() == 3 && tokens.get(0).equals(FERMION) && tokens.get(1).equals(IRCOP)) {
      symmetry = tokens.get(2);
      
    } else if (tokens.size() >= 4 &&
        tokenPairAt(tokens, 1, ELECTRONIC, EIGENVALUE) &&
        tokens.get(3).contains(NO)) {
      
      try {
        String no = stripIndex(tokens.get(3));
        if (no.isEmpty() && tokens.size() > 4)
          no = stripIndex(tokens.get(4));
        electronNo = Integer.parseInt(no);
        energy = Double.parseDouble(tokens.get(tokens.size() - 1));
      } catch (NumberFormatException nfx) {
        throw new InvalidEigenvalueHeaderException(line, nfx);
      }
      sums = new Accumulation(labels.atoms());
      state = ScanState.READING_COEFFICIENTS;
    }
  }
  
  
  private static String stripIndex(String token) {
    int start = token.startsWith(NO) ? NO.length() : 0;
    int end = token.endsWith(":") ? token.length() - 1 : token.length();
    return start >= end ? "" : token.substring(start, end);
  }
  
  
  private void readCoefficients(List<String> tokens) {
    final int count = tokens.size();
    if (count == 0) {
      var result = summarizer.summarize(symmetry, electronNo, energy, sums);
      sysLogger().log(
          Level.TRACE, "MO %s no. %d (%s): %d rows"
          .formatted(symmetry, electronNo, energy, result.rows().size()));
      collector.add(result);
      sums = null;
      state = ScanState.WAITING_FOR_EIGENVALUE_HEADER;
    
    } else if (count >= MIN_ROW_TOKENS && count <= MAX_ROW_TOKENS) {
      addRow(tokens);
    }
  }
  
  
  private void addRow(List<String> rawTokens) {
    var tokens = TokenReassembler.reassemble(rawTokens);
    int amplitudesStart = tokens.size() - AMPLITUDES;
    if (amplitudesStart <= ROW_PREFIX)
      throw new InvalidAtomTypeException(String.join(" ", rawTokens));
    
    var label = labels.resolve(
        String.join(" ", tokens.subList(ROW_PREFIX, amplitudesStart)));
    sums.add(label, tokens.subList(amplitudesStart, tokens.size()));
  }
  
  
  private static boolean tokenPairAt(List<String> tokens, int index, String first, String second) {
    return
        tokens.size() > index + 1 &&
        tokens.get(index).equals(first) &&
        tokens.get(index + 1).equals(second);
  }
  
  
  @Override
  public String toString() {
    return getClass().getSimpleName() +
        "[state=" + state + ",lineNo=" + lineNo + ",results=" + collector.size() + "]";
  }

}
