/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.dfcoef.cli.sdc;


import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.junit.jupiter.api.Test;

import io.crums.dfcoef.ContributionRow;
import io.crums.dfcoef.MoResult;

/**
 * 
 */
public class ResultPrinterTest {
  
  final static MoResult B3G = new MoResult(
      "B3g", 22, -2.8417809384721,
      List.of(
          new ContributionRow("Cl", "dyz", 87.5),
          new ContributionRow("F", "pz", 12.5)),
      2.0, 1.0);
  
  
  private static List<String> print(PrintSettings settings, MoResult... results) {
    var bytes = new ByteArrayOutputStream();
    var out = new PrintStream(bytes, true, StandardCharsets.UTF_8);
    new ResultPrinter(out, settings).printAll(List.of(results));
    return new String(bytes.toByteArray(), StandardCharsets.UTF_8).lines().toList();
  }
  

  @Test
  public void testExpanded() {
    var lines = print(PrintSettings.DEFAULT, B3G);
    assertEquals(
        List.of(
            "B3g 22 -2.8417809384721",
            "Cl_dyz  87.50000%",
            "F_pz    12.50000%",
            ""),
        lines);
  }
  
  
  @Test
  public void testCompressed() {
    var lines = print(new PrintSettings(3, true, false), B3G);
    assertEquals(List.of("B3g 22 -2.8417809384721 Cl_dyz 87.500 F_pz 12.500"), lines);
  }
  
  
  @Test
  public void testDebug() {
    var lines = print(new PrintSettings(2, false, true), B3G);
    assertEquals(
        List.of(
            "B3g 22 -2.8417809384721",
            "Cl_dyz  87.50%",
            "F_pz    12.50%",
            "Normalization constant is 2.00",
            "sum of coefficient 1.00",
            ""),
        lines);
  }
  
  
  @Test
  public void testNoRows() {
    var empty = new MoResult("Ag", 1, -0.5, List.of());
    assertEquals(List.of("Ag 1 -0.5", ""), print(PrintSettings.DEFAULT, empty));
    assertEquals(List.of("Ag 1 -0.5"), print(new PrintSettings(5, true, false), empty));
  }
  
  
  @Test
  public void testPlainEnergy() {
    var tiny = new MoResult("Ag", 1, -1.5e-5, List.of());
    assertEquals("Ag 1 -0.000015", new ResultPrinter(System.out, PrintSettings.DEFAULT).header(tiny));
  }
  
  
  @Test
  public void testDecimalsBounds() {
    assertThrows(IllegalArgumentException.class, () -> new PrintSettings(0, false, false));
    assertThrows(IllegalArgumentException.class, () -> new PrintSettings(16, false, false));
    new PrintSettings(15, false, false);
  }

}
