/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.dfcoef;


import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Decodes the fused symmetry / atom / orbital-type text of a coefficient row.
 * The text is divided into runs, each an uppercase letter followed by
 * non-uppercase chars. The first run is the symmetry label; the second
 * begins with the element symbol (2-letter symbols preferred over 1-letter
 * ones) followed by the orbital type. For example,
 * <pre>
 *   "B3gCl 3dyz"  -> (B3g, Cl, dyz)
 *   "Ag Cu s"     -> (Ag, Cu, s)
 * </pre>
 * The orbital type's leading digits (its principal quantum number) and
 * spaces are dropped.
 */
public class LabelResolver {
  
  private final AtomSpec atoms;
  
  /**
   * @param atoms   the molecule; decoded atoms must belong to it
   */
  public LabelResolver(AtomSpec atoms) {
    this.atoms = Objects.requireNonNull(atoms, "null atoms");
  }
  
  
  public AtomSpec atoms() {
    return atoms;
  }
  
  
  /**
   * Decodes the given text.
   * 
   * @param text    the label tokens of a coefficient row, joined by single spaces
   * 
   * @throws InvalidAtomTypeException if no element symbol is found where expected
   * @throws AtomNotInMoleculeSpecException if the element is not in the molecule
   */
  public FusedLabel resolve(String text)
      throws InvalidAtomTypeException, AtomNotInMoleculeSpecException {
    
    var runs = upperCaseRuns(text);
    if (runs.size() < 2)
      throw new InvalidAtomTypeException(text);
    
    String symmetry = runs.get(0).strip();
    String atomOrbital = runs.get(1);
    
    String atom;
    if (atomOrbital.length() >= 2 && Elements.isSymbol(atomOrbital.substring(0, 2)))
      atom = atomOrbital.substring(0, 2);
    else if (Elements.isSymbol(atomOrbital.substring(0, 1)))
      atom = atomOrbital.substring(0, 1);
    else
      throw new InvalidAtomTypeException(atomOrbital);
    
    if (!atoms.contains(atom))
      throw new AtomNotInMoleculeSpecException(atom, atoms);
    
    String orbital = stripQuantumNo(atomOrbital.substring(atom.length()));
    return new FusedLabel(symmetry, atom, orbital);
  }
  
  
  /**
   * Divides the given text into runs, each an uppercase letter followed by zero
   * or more non-uppercase chars. Any text before the first uppercase letter is
   * not part of any run.
   */
  static List<String> upperCaseRuns(String text) {
    var runs = new ArrayList<String>(3);
    int start = 0;
    while (start < text.length() && !Elements.isUpper(text.charAt(start)))
      ++start;
    while (start < text.length()) {
      int end = start + 1;
      while (end < text.length() && !Elements.isUpper(text.charAt(end)))
        ++end;
      runs.add(text.substring(start, end));
      start = end;
    }
    return runs;
  }
  
  
  private static String stripQuantumNo(String orbital) {
    int index = 0;
    while (index < orbital.length()) {
      char c = orbital.charAt(index);
      if (c != ' ' && !Elements.isDigit(c))
        break;
      ++index;
    }
    return orbital.substring(index).strip();
  }

}
