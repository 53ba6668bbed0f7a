package io.lacuna.modular;

import java.util.regex.PatternSyntaxException;

/**
 * Thrown when a pattern handed to {@link RegexCompiler} uses a character outside its alphabet, or is malformed.
 */
public class RegexSyntaxException extends PatternSyntaxException {

  private static final long serialVersionUID = 4129760351128264872L;

  public RegexSyntaxException(String description, String regex, int index) {
    super(description, regex, index);
  }
}
