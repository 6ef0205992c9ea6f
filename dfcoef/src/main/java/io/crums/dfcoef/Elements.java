/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.dfcoef;


import java.util.List;
import java.util.Set;

/**
 * The chemical element symbols, H thru Og.
 */
public class Elements {

  // never
  private Elements() {  }
  
  
  /** Element symbols in atomic-number order (index 0 is hydrogen). */
  public final static List<String> SYMBOLS = List.of(
      "H",                                                                                 "He",
      "Li", "Be",                                                  "B",  "C",  "N",  "O",  "F",  "Ne",
      "Na", "Mg",                                                  "Al", "Si", "P",  "S",  "Cl", "Ar",
      "K",  "Ca", "Sc", "Ti", "V",  "Cr", "Mn", "Fe", "Co", "Ni", "Cu", "Zn", "Ga", "Ge", "As", "Se", "Br", "Kr",
      "Rb", "Sr", "Y",  "Zr", "Nb", "Mo", "Tc", "Ru", "Rh", "Pd", "Ag", "Cd", "In", "Sn", "Sb", "Te", "I",  "Xe",
      "Cs", "Ba",
            "La", "Ce", "Pr", "Nd", "Pm", "Sm", "Eu", "Gd", "Tb", "Dy", "Ho", "Er", "Tm", "Yb", "Lu",
                  "Hf", "Ta", "W",  "Re", "Os", "Ir", "Pt", "Au", "Hg", "Tl", "Pb", "Bi", "Po", "At", "Rn",
      "Fr", "Ra",
            "Ac", "Th", "Pa", "U",  "Np", "Pu", "Am", "Cm", "Bk", "Cf", "Es", "Fm", "Md", "No", "Lr",
                  "Rf", "Db", "Sg", "Bh", "Hs", "Mt", "Ds", "Rg", "Cn", "Nh", "Fl", "Mc", "Lv", "Ts", "Og");
  
  private final static Set<String> SYMBOL_SET = Set.copyOf(SYMBOLS);
  
  
  /** Determines whether the given (case-sensitive) string is an element symbol. */
  public static boolean isSymbol(String symbol) {
    return symbol != null && SYMBOL_SET.contains(symbol);
  }
  
  
  /** ASCII {@code A-Z} only. */
  static boolean isUpper(char c) {
    return c >= 'A' && c <= 'Z';
  }
  
  /** ASCII {@code a-z} only. */
  static boolean isLower(char c) {
    return c >= 'a' && c <= 'z';
  }
  
  /** ASCII {@code 0-9} only. */
  static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }

}
