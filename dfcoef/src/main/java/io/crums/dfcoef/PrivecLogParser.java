/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.dfcoef;


import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Feeds a {@linkplain PrivecScanner} the lines of a DIRAC log. Lines are read
 * lazily; reading stops as soon as the vector-print section ends.
 * 
 * @see #summarize(Path, AtomSpec, ScanConfig)
 */
public class PrivecLogParser {
  
  private PrivecLogParser() {  }
  
  
  /**
   * Scans the given DIRAC output file (UTF-8) and returns its MO summaries.
   * 
   * @param log     path to the DIRAC output
   * @param atoms   the molecule
   * @param config  threshold, diagnostics, and ordering settings
   * 
   * @return read-only list of results
   * @throws DfcoefException if the log does not match the molecule (or is malformed)
   */
  public static List<MoResult> summarize(Path log, AtomSpec atoms, ScanConfig config)
      throws IOException {
    
    try (var reader = Files.newBufferedReader(log, StandardCharsets.UTF_8)) {
      return summarize(reader, atoms, config);
    }
  }
  
  
  /**
   * Scans the lines of the given reader and returns its MO summaries. Lines
   * past the end of the vector-print section are not read; the reader is
   * not closed.
   * 
   * @param log     line terminators may be {@code \n}, {@code \r\n}, or {@code \r}
   * @param atoms   the molecule
   * @param config  threshold, diagnostics, and ordering settings
   * 
   * @return read-only list of results
   * @throws DfcoefException if the log does not match the molecule (or is malformed)
   */
  public static List<MoResult> summarize(BufferedReader log, AtomSpec atoms, ScanConfig config)
      throws IOException {
    
    var scanner = new PrivecScanner(atoms, config);
    try {
      return scanner.scan(log.lines());
    } catch (UncheckedIOException uiox) {
      throw uiox.getCause();
    }
  }

}
