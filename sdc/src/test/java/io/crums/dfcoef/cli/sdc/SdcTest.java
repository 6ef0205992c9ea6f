/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.dfcoef.cli.sdc;


import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import picocli.CommandLine;

/**
 * 
 */
public class SdcTest {
  
  final static String B3G_LOG = "b3g.out";
  
  @TempDir
  Path dir;
  
  
  private Path copyResource(String resource) throws IOException {
    var file = dir.resolve(resource);
    try (var in = getClass().getResourceAsStream(resource)) {
      Files.copy(in, file);
    }
    return file;
  }
  
  
  private static int execute(String... args) {
    var cli = new CommandLine(new Sdc());
    cli.setErr(new PrintWriter(new StringWriter()));
    return cli.execute(args);
  }
  

  @Test
  public void testDefaults() throws IOException {
    var log = copyResource(B3G_LOG);
    var report = dir.resolve("report.txt");
    int exitCode = execute("-i", log.toString(), "-m", "ClF", "-o", report.toString());
    assertEquals(0, exitCode);
    assertEquals(
        List.of(
            "Ag 3 -20.5",
            "Cl_s  100.00000%",
            "",
            "B3g 22 -2.8417809384721",
            "Cl_dyz  87.50000%",
            "F_pz    12.50000%",
            ""),
        Files.readAllLines(report));
  }
  
  
  @Test
  public void testCompressedNoSortDebug() throws IOException {
    var log = copyResource(B3G_LOG);
    var report = dir.resolve("report.txt");
    int exitCode = execute(
        "--input", log.toString(), "--mol", "ClF",
        "--compress", "--no-sort", "--debug", "--decimal", "3",
        "--output", report.toString());
    assertEquals(0, exitCode);
    assertEquals(
        List.of(
            "B3g 22 -2.8417809384721 Cl_dyz 87.500 F_pz 12.500",
            "Normalization constant is 2.000",
            "sum of coefficient 1.000",
            "Ag 3 -20.5 Cl_s 100.000",
            "Normalization constant is 1.000",
            "sum of coefficient 1.000"),
        Files.readAllLines(report));
  }
  
  
  @Test
  public void testThreshold() throws IOException {
    var log = copyResource(B3G_LOG);
    var report = dir.resolve("report.txt");
    int exitCode = execute(
        "-i", log.toString(), "-m", "ClF", "-t", "50", "-c", "-o", report.toString());
    assertEquals(0, exitCode);
    assertEquals(
        List.of(
            "Ag 3 -20.5 Cl_s 100.00000",
            "B3g 22 -2.8417809384721 Cl_dyz 87.50000"),
        Files.readAllLines(report));
  }
  
  
  @Test
  public void testEquivalentAtoms() throws IOException {
    var log = copyResource(B3G_LOG);
    var report = dir.resolve("report.txt");
    int exitCode = execute("-i", log.toString(), "-m", "Cl2F", "-c", "-d", "2", "-o", report.toString());
    assertEquals(0, exitCode);
    // Cl: 3.5 / 3.75 / 2 ; F: 0.25 / 3.75
    assertEquals(
        List.of(
            "Ag 3 -20.5 Cl_s 50.00 Cl_s 50.00",
            "B3g 22 -2.8417809384721 Cl_dyz 46.67 Cl_dyz 46.67 F_pz 6.67"),
        Files.readAllLines(report));
  }
  
  
  @Test
  public void testAtomNotInMolecule() throws IOException {
    var log = copyResource(B3G_LOG);
    var report = dir.resolve("report.txt");
    int exitCode = execute("-i", log.toString(), "-m", "Cl", "-o", report.toString());
    assertEquals(Sdc.ERR_USER, exitCode);
    assertFalse(Files.exists(report));
  }
  
  
  @Test
  public void testBadOptions() throws IOException {
    var log = copyResource(B3G_LOG).toString();
    var usage = CommandLine.ExitCode.USAGE;
    assertEquals(usage, execute("-i", log));
    assertEquals(usage, execute("-m", "ClF"));
    assertEquals(usage, execute("-i", dir.resolve("nope.out").toString(), "-m", "ClF"));
    assertEquals(usage, execute("-i", log, "-m", "ClF2000000000"));
    assertEquals(usage, execute("-i", log, "-m", "ClXx"));
    assertEquals(usage, execute("-i", log, "-m", "ClFCl"));
    assertEquals(usage, execute("-i", log, "-m", "ClF", "-d", "0"));
    assertEquals(usage, execute("-i", log, "-m", "ClF", "-d", "16"));
    assertEquals(usage, execute("-i", log, "-m", "ClF", "--threshold=-1"));
  }

}
