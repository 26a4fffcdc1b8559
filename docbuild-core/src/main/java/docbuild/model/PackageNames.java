package docbuild.model;

import java.util.Locale;
import java.util.Objects;

/**
 * Package name normalization. Two names that differ only in case or in
 * {@code -}/{@code _} separators refer to the same package.
 */
public final class PackageNames {

  private PackageNames() {}

  public static String normalize(String name) {
    Objects.requireNonNull(name, "name");
    String trimmed = name.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException("package name must not be empty");
    }
    return trimmed.toLowerCase(Locale.ROOT).replace('_', '-');
  }

  public static boolean sameName(String a, String b) {
    return normalize(a).equals(normalize(b));
  }
}
