package ca.gc.cra.scribe.domain.state;

import java.util.List;
import java.util.Objects;

/**
 * Conversions between nested state paths and their dot-joined history keys.
 *
 * @since 0.1.0
 */
public final class StatePath {
  /** Separator between path segments in history keys. */
  public static final String SEPARATOR = ".";

  private StatePath() {
    // Utility
  }

  /**
   * Validates a nested path.
   *
   * @param path ordered segments; must be non-empty and contain no {@code null} segments
   * @return immutable copy of {@code path}
   * @throws IllegalArgumentException if {@code path} is empty
   */
  public static List<String> require(List<String> path) {
    Objects.requireNonNull(path, "path");
    if (path.isEmpty()) {
      throw new IllegalArgumentException("path must not be empty");
    }
    return List.copyOf(path);
  }

  public static String join(List<String> path) {
    return String.join(SEPARATOR, path);
  }

  /**
   * Splits a history key back into path segments.
   *
   * @param key dot-joined key
   * @return path segments
   */
  public static List<String> split(String key) {
    return List.of(key.split("\\.", -1));
  }

  public static boolean isNested(String key) {
    return key.contains(SEPARATOR);
  }
}
