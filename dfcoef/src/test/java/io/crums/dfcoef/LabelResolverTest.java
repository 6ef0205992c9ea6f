/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.dfcoef;


import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

/**
 * 
 */
public class LabelResolverTest {
  
  private final LabelResolver resolver = new LabelResolver(AtomSpec.parse("CuClCH4"));

  @Test
  public void testFused() {
    assertEquals(new FusedLabel("B3g", "Cl", "dyz"), resolver.resolve("B3gCl 3dyz"));
  }
  
  
  @Test
  public void testSeparated() {
    assertEquals(new FusedLabel("Ag", "Cu", "s"), resolver.resolve("Ag Cu s"));
  }
  
  
  @Test
  public void testPrefersTwoLetterSymbol() {
    var label = resolver.resolve("Ag Cu 3dxy");
    assertEquals("Cu", label.atom());
    assertEquals("dxy", label.orbital());
  }
  
  
  @Test
  public void testOneLetterSymbol() {
    assertEquals(new FusedLabel("Ag", "C", "px"), resolver.resolve("Ag C 2px"));
    assertEquals(new FusedLabel("E1u", "H", "s"), resolver.resolve("E1uH 1s"));
  }
  
  
  @Test
  public void testKey() {
    assertEquals("B3gCldyz", resolver.resolve("B3gCl 3dyz").key());
  }
  
  
  @Test
  public void testInvalidAtomType() {
    var x = assertThrows(InvalidAtomTypeException.class, () -> resolver.resolve("Ag Qq s"));
    assertEquals("Qq s", x.getText());
    assertThrows(InvalidAtomTypeException.class, () -> resolver.resolve("Ag"));
    assertThrows(InvalidAtomTypeException.class, () -> resolver.resolve(""));
  }
  
  
  @Test
  public void testAtomNotInSpec() {
    var x = assertThrows(AtomNotInMoleculeSpecException.class, () -> resolver.resolve("B3gO 2pz"));
    assertEquals("O", x.getSymbol());
  }
  
  
  @Test
  public void testNonAsciiUpperCaseIsNotARunStart() {
    // Greek capital sigma stays in the symmetry run
    assertEquals(
        new FusedLabel("B3g\u03A3", "Cl", "dyz"), resolver.resolve("B3g\u03A3Cl 3dyz"));
    assertEquals(List.of("E\u00C9u", "H 1s"), LabelResolver.upperCaseRuns("E\u00C9uH 1s"));
  }
  
  
  @Test
  public void testNonAsciiDigitKeptInOrbital() {
    // fullwidth digit three is not a principal quantum number
    assertEquals("\uFF13dyz", resolver.resolve("B3gCl \uFF13dyz").orbital());
  }
  
  
  @Test
  public void testUpperCaseRuns() {
    assertEquals(List.of("B3g", "Cl 3dyz"), LabelResolver.upperCaseRuns("B3gCl 3dyz"));
    assertEquals(List.of("Ag ", "Cu s"), LabelResolver.upperCaseRuns("Ag Cu s"));
    assertEquals(List.of("Ag"), LabelResolver.upperCaseRuns("1 Ag"));
    assertEquals(List.of(), LabelResolver.upperCaseRuns("3dxy"));
  }

}
