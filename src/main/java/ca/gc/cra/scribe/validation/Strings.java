package ca.gc.cra.scribe.validation;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Validation utilities for strings read from SCRIBE configuration.
 * <p><strong>Why:</strong> Ensures keys, paths and identifiers start sanitized so the state store and
 * registry never see blank or control-character names.</p>
 * <p><strong>Thread-safety:</strong> Immutable stateless utilities; safe for concurrent access.</p>
 *
 * @since 0.1.0
 * @see Numbers
 */
public final class Strings {
  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-blank, and control-character free.
   *
   * @param name logical parameter name for diagnostics; if {@code null} defaults to {@code "value"}
   * @param value candidate text; must not be {@code null}
   * @return trimmed input
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the trimmed value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    if (containsControl(trimmed)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    return trimmed;
  }

  /**
   * Splits a comma-separated list, trimming entries and dropping empty ones.
   *
   * @param name logical parameter name for diagnostics
   * @param value comma-separated text; {@code null} or blank yields an empty list
   * @return immutable list of validated entries in input order
   * @throws IllegalArgumentException if an entry contains ISO control characters
   */
  public static List<String> splitCsv(String name, String value) {
    if (value == null || value.isBlank()) {
      return List.of();
    }
    List<String> entries = new ArrayList<>();
    for (String part : value.split(",")) {
      if (!part.isBlank()) {
        entries.add(requireNonBlank(name, part));
      }
    }
    return List.copyOf(entries);
  }

  private static boolean containsControl(String value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String detail) {
    return (name == null || name.isBlank() ? "value" : name) + ' ' + detail;
  }
}
