/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.dfcoef.cli.sdc;


import java.io.PrintStream;
import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

import io.crums.dfcoef.ContributionRow;
import io.crums.dfcoef.MoResult;

/**
 * Renders {@linkplain MoResult}s as text. Normally, an MO is printed as a
 * header line followed by one line per contribution, and a blank line:
 * <pre>
 * B3g 22 -2.8417809384721
 * Cl_dyz  87.50000%
 * F_pz    12.50000%
 * 
 * </pre>
 * Compressed, the contributions follow the header on the same line:
 * <pre>
 * B3g 22 -2.8417809384721 Cl_dyz 87.50000 F_pz 12.50000
 * </pre>
 */
public class ResultPrinter {
  
  private final PrintStream out;
  private final PrintSettings settings;
  private final String numberFormat;
  
  
  public ResultPrinter(PrintStream out, PrintSettings settings) {
    this.out = Objects.requireNonNull(out, "null out");
    this.settings = Objects.requireNonNull(settings, "null settings");
    this.numberFormat = "%." + settings.decimals() + "f";
  }
  
  
  public void printAll(List<MoResult> results) {
    results.forEach(this::print);
    out.flush();
  }
  
  
  public void print(MoResult result) {
    if (settings.compress())
      printCompressed(result);
    else
      printExpanded(result);
  }
  
  
  /** Returns the header: symmetry, eigenvalue no., and energy. */
  public String header(MoResult result) {
    return "%s %d %s".formatted(
        result.symmetry(),
        result.electronNo(),
        BigDecimal.valueOf(result.energy()).toPlainString());
  }
  
  
  private void printCompressed(MoResult result) {
    var line = new StringBuilder(header(result));
    for (var row : result.rows())
      line.append(' ').append(row.label()).append(' ').append(format(row.percentage()));
    out.println(line);
    if (settings.debug())
      printDiagnostics(result);
  }
  
  
  private void printExpanded(MoResult result) {
    out.println(header(result));
    
    int width = 0;
    for (var row : result.rows())
      width = Math.max(width, row.label().length());
    
    for (var row : result.rows())
      out.println(rowLine(row, width));
    
    if (settings.debug())
      printDiagnostics(result);
    out.println();
  }
  
  
  private String rowLine(ContributionRow row, int width) {
    var line = new StringBuilder(row.label());
    while (line.length() < width)
      line.append(' ');
    return line.append("  ").append(format(row.percentage())).append('%').toString();
  }
  
  
  private void printDiagnostics(MoResult result) {
    out.println("Normalization constant is " + format(result.normConstant()));
    out.println("sum of coefficient " + format(result.coefficientSum()));
  }
  
  
  private String format(double value) {
    return String.format(Locale.ROOT, numberFormat, value);
  }

}
