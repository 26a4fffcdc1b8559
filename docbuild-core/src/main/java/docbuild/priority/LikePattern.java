package docbuild.priority;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Matcher for SQL {@code LIKE} patterns: {@code %} matches any run of
 * characters, {@code _} matches exactly one, {@code \} escapes either.
 * Matching is case-sensitive, as in standard SQL.
 */
public final class LikePattern {
  private final String pattern;
  private final Pattern regex;

  private LikePattern(String pattern) {
    this.pattern = pattern;
    this.regex = Pattern.compile(toRegex(pattern), Pattern.DOTALL);
  }

  public static LikePattern compile(String pattern) {
    Objects.requireNonNull(pattern, "pattern");
    return new LikePattern(pattern);
  }

  public boolean matches(String value) {
    return value != null && regex.matcher(value).matches();
  }

  public String pattern() {
    return pattern;
  }

  private static String toRegex(String like) {
    StringBuilder sb = new StringBuilder(like.length() + 8);
    StringBuilder literal = new StringBuilder();
    boolean escaped = false;
    for (int i = 0; i < like.length(); i++) {
      char c = like.charAt(i);
      if (escaped) {
        literal.append(c);
        escaped = false;
      } else if (c == '\\') {
        escaped = true;
      } else if (c == '%' || c == '_') {
        flush(sb, literal);
        sb.append(c == '%' ? ".*" : ".");
      } else {
        literal.append(c);
      }
    }
    if (escaped) {
      literal.append('\\');
    }
    flush(sb, literal);
    return sb.toString();
  }

  private static void flush(StringBuilder sb, StringBuilder literal) {
    if (literal.length() > 0) {
      sb.append(Pattern.quote(literal.toString()));
      literal.setLength(0);
    }
  }

  @Override
  public String toString() {
    return pattern;
  }
}
