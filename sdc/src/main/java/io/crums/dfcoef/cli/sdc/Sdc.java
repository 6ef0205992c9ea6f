/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.dfcoef.cli.sdc;


import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.Callable;

import io.crums.dfcoef.AtomSpec;
import io.crums.dfcoef.DfcoefConstants;
import io.crums.dfcoef.DfcoefException;
import io.crums.dfcoef.MoResult;
import io.crums.dfcoef.PrivecLogParser;
import io.crums.dfcoef.ScanConfig;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Help.Ansi;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

/**
 * Summarizes atomic orbital contributions to the molecular orbitals in a
 * DIRAC output file. Main launch class.
 */
@Command(
    name = "sdc",
    mixinStandardHelpOptions = true,
    version = "sdc 0.1",
    synopsisHeading = "",
    customSynopsis = {
        "Summarizes DIRAC molecular orbital (MO) coefficients.",
        "",
        "Reads the vector-print (@|bold PRIVEC|@) section of a DIRAC output file and reports,",
        "for each MO, the percentage contributed by each atom and orbital type.",
        "Contributions are divided equally among atoms of the same type.",
        "",
        "@|bold Usage:|@",
        "",
        "  @|bold sdc|@ @|fg(yellow) -i|@ FILE @|fg(yellow) -m|@ MOLECULE [OPTIONS]",
        "  @|bold sdc|@ [@|fg(yellow) -hV|@]",
        "",
        "@|bold Example:|@",
        "",
        "  @|bold sdc|@ @|fg(yellow) -i|@ x2c_uo2_238.out @|fg(yellow) -m|@ UO2 @|fg(yellow) -t|@ 1",
        "",
    })
public class Sdc implements Callable<Integer> {
  

  public static void main(String[] args) {
    int exitCode;
    try {
      exitCode = new CommandLine(new Sdc()).execute(args);
    } catch (Exception x) {
      System.err.printf("Unhandled exception: %s%n", x.toString());
      x.printStackTrace();
      exitCode = ERR_SOFT;
    }
    System.exit(exitCode);
  }
  

  final static int ERR_SOFT = 1;
  final static int ERR_USER = 2;
  final static int ERR_IO = 4;
  
  
  
  @Spec
  private CommandSpec spec;
  
  
  private File input;
  
  @Option(
      names = { "-i", "--input" },
      required = true,
      paramLabel = "FILE",
      description = {
          "DIRAC output file",
      })
  public void setInput(File input) {
    if (!input.isFile())
      throw new ParameterException(spec.commandLine(), "not a file: " + input);
    if (!input.canRead())
      throw new ParameterException(spec.commandLine(), "need read permission: " + input);
    this.input = input;
  }
  
  
  private AtomSpec molecule;
  
  @Option(
      names = { "-m", "--mol" },
      required = true,
      paramLabel = "MOLECULE",
      description = {
          "Molecular formula, e.g. @|fg(yellow) Cu2O|@, @|fg(yellow) UO2|@.",
          "Each element may appear only once.",
      })
  public void setMolecule(String formula) {
    try {
      this.molecule = AtomSpec.parse(formula);
    } catch (DfcoefException dx) {
      throw new ParameterException(spec.commandLine(), dx.getMessage(), dx);
    }
  }
  
  
  @Option(
      names = { "-c", "--compress" },
      description = {
          "Print one line per MO",
      })
  private boolean compress;
  
  
  private double threshold = DfcoefConstants.DEFAULT_THRESHOLD;
  
  @Option(
      names = { "-t", "--threshold" },
      paramLabel = "PERCENT",
      description = {
          "Minimum contribution (percent) reported",
          "Default: " + DfcoefConstants.DEFAULT_THRESHOLD,
      })
  public void setThreshold(double threshold) {
    if (!(threshold >= 0))
      throw new ParameterException(
          spec.commandLine(), "threshold must be >= 0: " + threshold);
    this.threshold = threshold;
  }
  
  
  private int decimals = PrintSettings.DEFAULT_DECIMALS;
  
  @Option(
      names = { "-d", "--decimal" },
      paramLabel = "DIGITS",
      description = {
          "Number of decimal places printed",
          "Valid values: " + PrintSettings.MIN_DECIMALS + " thru " + PrintSettings.MAX_DECIMALS,
          "Default: " + PrintSettings.DEFAULT_DECIMALS,
      })
  public void setDecimals(int decimals) {
    if (decimals < PrintSettings.MIN_DECIMALS || decimals > PrintSettings.MAX_DECIMALS)
      throw new ParameterException(
          spec.commandLine(), "decimal places out-of-bounds: " + decimals);
    this.decimals = decimals;
  }
  
  
  @Option(
      names = "--debug",
      description = {
          "Also print the normalization constant and the",
          "sum of coefficients for each MO",
      })
  private boolean debug;
  
  
  @Option(
      names = "--no-sort",
      description = {
          "Print MOs in the order they occur in the file",
          "(by default, they're sorted by energy)",
      })
  private boolean noSort;
  
  
  @Option(
      names = { "-o", "--output" },
      paramLabel = "FILE",
      description = {
          "Write the report to the given file (instead of stdout)",
      })
  private File output;
  
  
  
  public ScanConfig getScanConfig() {
    return new ScanConfig(threshold, debug, !noSort);
  }
  
  
  public PrintSettings getPrintSettings() {
    return new PrintSettings(decimals, compress, debug);
  }
  
  

  @Override
  public Integer call() {
    
    List<MoResult> results;
    try {
      
      results = PrivecLogParser.summarize(input.toPath(), molecule, getScanConfig());
    
    } catch (DfcoefException dx) {
      printError(dx.getMessage());
      System.err.println(Ansi.AUTO.string(
          "@|italic Check that molecule " + molecule.formula() + " describes " + input + "|@"));
      return ERR_USER;
    
    } catch (IOException iox) {
      printError("failed reading " + input + ": " + iox.getMessage());
      return ERR_IO;
    }
    
    if (output == null) {
      new ResultPrinter(System.out, getPrintSettings()).printAll(results);
      return 0;
    }
    
    try (var out = new PrintStream(new FileOutputStream(output), false, StandardCharsets.UTF_8)) {
      new ResultPrinter(out, getPrintSettings()).printAll(results);
      if (out.checkError())
        throw new IOException("write error");
    } catch (IOException iox) {
      printError("failed writing " + output + ": " + iox.getMessage());
      return ERR_IO;
    }
    
    return 0;
  }
  
  
  static void printError(String message) {
    System.err.println(Ansi.AUTO.string("[@|fg(red),bold ERROR|@]: " + message));
  }

}
