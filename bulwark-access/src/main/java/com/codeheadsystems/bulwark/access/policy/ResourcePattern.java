package com.codeheadsystems.bulwark.access.policy;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Resource patterns: a glob ({@code *} any run of characters, {@code ?} one character) or,
 * with the {@code regex:} prefix, a full regular expression. Both must match the whole
 * resource.
 */
public final class ResourcePattern {

  public static final String REGEX_PREFIX = "regex:";

  private ResourcePattern() {
  }

  /**
   * Compiles a pattern.
   *
   * @param pattern the pattern
   * @return the compiled pattern
   * @throws IllegalArgumentException if the regular expression is invalid
   */
  public static Pattern compile(String pattern) {
    if (pattern == null || pattern.isEmpty()) {
      throw new IllegalArgumentException("Missing required field: resourcePattern");
    }
    try {
      if (pattern.startsWith(REGEX_PREFIX)) {
        return Pattern.compile(pattern.substring(REGEX_PREFIX.length()));
      }
      return Pattern.compile(globToRegex(pattern));
    } catch (PatternSyntaxException e) {
      throw new IllegalArgumentException("Invalid resource pattern: " + pattern, e);
    }
  }

  static String globToRegex(String glob) {
    StringBuilder regex = new StringBuilder();
    StringBuilder literal = new StringBuilder();
    for (char c : glob.toCharArray()) {
      if (c == '*' || c == '?') {
        if (literal.length() > 0) {
          regex.append(Pattern.quote(literal.toString()));
          literal.setLength(0);
        }
        regex.append(c == '*' ? ".*" : ".");
      } else {
        literal.append(c);
      }
    }
    if (literal.length() > 0) {
      regex.append(Pattern.quote(literal.toString()));
    }
    return regex.toString();
  }
}
