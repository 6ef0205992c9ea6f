/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.dfcoef;


import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The atoms of a molecule, as parsed from a molecular formula such as
 * {@code "Cu2O"}. Immutable.
 * 
 * <h2>Formula Syntax</h2>
 * <p>
 * The formula is divided into segments, each beginning with an uppercase
 * letter and running up to (but excluding) the next uppercase letter. In each
 * segment the letters name the element and the digits, if any, give the number
 * of atoms of that element (default 1). An element may appear only once.
 * </p>
 * 
 * @see #parse(String)
 */
public class AtomSpec {
  
  
  /**
   * Parses the given molecular formula.
   * 
   * @param formula e.g. {@code "Cu2O"}, {@code "UO2"}
   * 
   * @throws MissingMoleculeSpecException if {@code formula} is null or blank
   * @throws InvalidElementSymbolException if a segment does not name an element
   * @throws DuplicateAtomTypeException if an element repeats
   */
  public static AtomSpec parse(String formula)
      throws MissingMoleculeSpecException,
             InvalidElementSymbolException,
             DuplicateAtomTypeException {
    
    if (formula == null || formula.isBlank())
      throw new MissingMoleculeSpecException();
    
    final String text = formula.strip();
    
    if (!Elements.isUpper(text.charAt(0)))
      throw new InvalidElementSymbolException(text, text);
    
    var types = new LinkedHashMap<String, AtomType>();
    
    for (int start = 0; start < text.length(); ) {
      int end = start + 1;
      while (end < text.length() && !Elements.isUpper(text.charAt(end)))
        ++end;
      
      var type = parseSegment(text, text.substring(start, end));
      if (types.put(type.symbol(), type) != null)
        throw new DuplicateAtomTypeException(text, type.symbol());
      
      start = end;
    }
    
    return new AtomSpec(text, new ArrayList<>(types.values()));
  }
  
  
  /**
   * Parses a segment of the form {@code [A-Z][a-z]*[0-9]*}.
   */
  private static AtomType parseSegment(String formula, String segment) {
    int digitsStart = 1;
    while (digitsStart < segment.length() && Elements.isLower(segment.charAt(digitsStart)))
      ++digitsStart;
    for (int index = digitsStart; index < segment.length(); ++index)
      if (!Elements.isDigit(segment.charAt(index)))
        throw new InvalidElementSymbolException(formula, segment);
    
    String symbol = segment.substring(0, digitsStart);
    if (!Elements.isSymbol(symbol))
      throw new InvalidElementSymbolException(formula, segment);
    
    int multiplicity;
    if (digitsStart == segment.length())
      multiplicity = 1;
    else try {
      multiplicity = Integer.parseInt(segment.substring(digitsStart));
    } catch (NumberFormatException nfx) {
      throw new InvalidElementSymbolException(formula, segment);
    }
    if (multiplicity < 1 || multiplicity > DfcoefConstants.MAX_MULTIPLICITY)
      throw new InvalidElementSymbolException(formula, segment);
    
    return new AtomType(symbol, multiplicity);
  }
  
  
  
  
  private final String formula;
  private final List<AtomType> types;
  private final Map<String, AtomType> bySymbol;
  
  
  private AtomSpec(String formula, List<AtomType> types) {
    this.formula = formula;
    this.types = List.copyOf(types);
    var map = new LinkedHashMap<String, AtomType>();
    for (var type : this.types)
      map.put(type.symbol(), type);
    this.bySymbol = Collections.unmodifiableMap(map);
  }
  
  
  /** Returns the atom types in formula order. */
  public List<AtomType> types() {
    return types;
  }
  
  
  /** Returns the formula this instance was parsed from. */
  public String formula() {
    return formula;
  }
  
  
  /** Determines whether the given element is part of the molecule. */
  public boolean contains(String symbol) {
    return bySymbol.containsKey(symbol);
  }
  
  
  /**
   * Returns the number of atoms of the given element.
   * 
   * @throws AtomNotInMoleculeSpecException if the element is not in the molecule
   */
  public int multiplicity(String symbol) throws AtomNotInMoleculeSpecException {
    var type = bySymbol.get(symbol);
    if (type == null)
      throw new AtomNotInMoleculeSpecException(symbol, this);
    return type.multiplicity();
  }
  
  
  @Override
  public boolean equals(Object o) {
    return o == this || o instanceof AtomSpec other && other.types.equals(types);
  }
  
  
  @Override
  public int hashCode() {
    return Objects.hash(types);
  }
  
  
  @Override
  public String toString() {
    return types.toString();
  }

}
