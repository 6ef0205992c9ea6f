/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.dfcoef;


import java.util.ArrayList;
import java.util.List;
import java.util.StringTokenizer;
import java.util.function.Function;

/**
 * Whitespace line tokenizer. A blank line yields an empty list.
 * Instances are stateless and thread-safe.
 * 
 * @see #INSTANCE
 */
public class RowTokenizer implements Function<String, List<String>> {
  
  /** Stateless instance. */
  public final static RowTokenizer INSTANCE = new RowTokenizer();

  @Override
  public List<String> apply(String line) {
    var tokenizer = new StringTokenizer(line);
    if (!tokenizer.hasMoreTokens())
      return List.of();

    var tokens = new ArrayList<String>();
    do {
      tokens.add(tokenizer.nextToken());
    } while (tokenizer.hasMoreTokens());
    
    return tokens;
  }

}
