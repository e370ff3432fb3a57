package ca.gc.cra.scribe.domain.state;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Helpers for the JSON-compatible value subset accepted by the state store.
 *
 * <p>Accepted values are {@code null}, {@link Boolean}, {@link Number}, {@link String}, collections of
 * accepted values (stored as {@link List}), and maps with string keys whose values are accepted values.</p>
 *
 * @since 0.1.0
 */
public final class JsonValues {
  private JsonValues() {
    // Utility
  }

  /**
   * Validates {@code value} and returns a deep copy built from mutable {@link LinkedHashMap} and
   * {@link ArrayList} containers.
   *
   * @param key state key used in diagnostics
   * @param value candidate value
   * @return deep copy of {@code value}
   * @throws IllegalArgumentException if {@code value} contains anything outside the JSON subset
   */
  public static Object deepCopy(String key, Object value) {
    if (value == null
        || value instanceof Boolean
        || value instanceof Number
        || value instanceof String) {
      return value;
    }
    if (value instanceof Map<?, ?> map) {
      Map<String, Object> copy = new LinkedHashMap<>();
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        if (!(entry.getKey() instanceof String field)) {
          throw new IllegalArgumentException(
              "State value for '" + key + "' contains a non-string map key: " + entry.getKey());
        }
        copy.put(field, deepCopy(key + '.' + field, entry.getValue()));
      }
      return copy;
    }
    if (value instanceof Collection<?> collection) {
      List<Object> copy = new ArrayList<>(collection.size());
      int index = 0;
      for (Object element : collection) {
        copy.add(deepCopy(key + '[' + index++ + ']', element));
      }
      return copy;
    }
    throw new IllegalArgumentException(
        "State value for '" + key + "' is not JSON-compatible: " + value.getClass().getName());
  }

  /**
   * Returns a deep copy wrapped in unmodifiable views, for values stored in history records and events.
   *
   * @param key state key used in diagnostics
   * @param value candidate value
   * @return unmodifiable deep copy
   * @throws IllegalArgumentException if {@code value} contains anything outside the JSON subset
   */
  public static Object frozenCopy(String key, Object value) {
    return freeze(deepCopy(key, value));
  }

  @SuppressWarnings("unchecked")
  private static Object freeze(Object value) {
    if (value instanceof Map<?, ?> map) {
      Map<String, Object> source = (Map<String, Object>) map;
      source.replaceAll((field, nested) -> freeze(nested));
      return Collections.unmodifiableMap(source);
    }
    if (value instanceof List<?> list) {
      List<Object> source = (List<Object>) list;
      source.replaceAll(JsonValues::freeze);
      return Collections.unmodifiableList(source);
    }
    return value;
  }
}
