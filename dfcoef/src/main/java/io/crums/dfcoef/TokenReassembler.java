/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.dfcoef;

import static io.crums.dfcoef.DfcoefConstants.LEGACY_DECIMALS;

import java.util.ArrayList;
import java.util.List;

/**
 * Repairs numeric tokens fused together by the legacy fixed-width format.
 * In that format each number carries exactly {@value DfcoefConstants#LEGACY_DECIMALS}
 * digits after the decimal point, and adjacent columns are not always separated
 * by whitespace when a number is negative. For example, the token
 * <pre>
 *   0.1234567890-0.0000012345
 * </pre>
 * is really two numbers.
 */
public class TokenReassembler {

  // never
  private TokenReassembler() {  }
  
  
  /**
   * Splits the given token into the numbers it encodes. If it contains fewer
   * than 2 decimal points, it is returned as-is in a singleton list. Otherwise
   * it is cut after each decimal point plus {@value DfcoefConstants#LEGACY_DECIMALS}
   * chars; the sign and integer digits before a point belong to its number.
   * 
   * @param token a whitespace-free token
   * @return non-empty list
   */
  public static List<String> split(String token) {
    int firstDot = token.indexOf('.');
    if (firstDot == -1 || token.indexOf('.', firstDot + 1) == -1)
      return List.of(token);
    
    var numbers = new ArrayList<String>(3);
    int start = 0;
    while (start < token.length()) {
      int dot = token.indexOf('.', start);
      int end = dot == -1 ?
          token.length() :
          Math.min(token.length(), dot + 1 + LEGACY_DECIMALS);
      numbers.add(token.substring(start, end));
      start = end;
    }
    return numbers;
  }
  
  
  /**
   * Returns the given tokens with every fused token {@linkplain #split(String) split}.
   * If no token needs splitting, the argument itself is returned.
   */
  public static List<String> reassemble(List<String> tokens) {
    List<String> out = null;
    for (int index = 0; index < tokens.size(); ++index) {
      var parts = split(tokens.get(index));
      if (out == null) {
        if (parts.size() == 1)
          continue;
        out = new ArrayList<>(tokens.size() + parts.size());
        out.addAll(tokens.subList(0, index));
      }
      out.addAll(parts);
    }
    return out == null ? tokens : out;
  }

}
