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
public class TokenReassemblerTest {

  @Test
  public void testSeparatedTokensUnchanged() {
    for (var token : List.of("B3gCl", "3dyz", "0.5000000000", "-0.0000000001", "12", "*****"))
      assertEquals(List.of(token), TokenReassembler.split(token));
    
    var tokens = List.of("1", "L", "B3gCl", "3dyz", "0.5000000000", "0.5000000000");
    assertSame(tokens, TokenReassembler.reassemble(tokens));
  }
  
  
  @Test
  public void testTwoFused() {
    assertEquals(
        List.of("0.1234567890", "-0.0000012345"),
        TokenReassembler.split("0.1234567890-0.0000012345"));
  }
  
  
  @Test
  public void testNFused() {
    var numbers = List.of("-0.1000000000", "-0.2000000000", "-0.3000000000", "-0.4000000000");
    var fused = String.join("", numbers);
    var split = TokenReassembler.split(fused);
    assertEquals(numbers.size(), split.size());
    assertEquals(numbers, split);
  }
  
  
  @Test
  public void testShortRemainder() {
    assertEquals(
        List.of("-1.0000000000", "-0.12"),
        TokenReassembler.split("-1.0000000000-0.12"));
  }
  
  
  @Test
  public void testReassembleRow() {
    var tokens = List.of(
        "4", "L", "B3gF", "2pz", "0.0000000000-0.0000000000", "0.0000000000", "*****");
    assertEquals(
        List.of("4", "L", "B3gF", "2pz", "0.0000000000", "-0.0000000000", "0.0000000000", "*****"),
        TokenReassembler.reassemble(tokens));
  }

}
