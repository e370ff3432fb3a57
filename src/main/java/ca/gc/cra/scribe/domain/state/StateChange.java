package ca.gc.cra.scribe.domain.state;

import java.time.Instant;
import java.util.Objects;

/**
 * Undo/redo record of one state mutation.
 *
 * <p>Both values are frozen deep copies taken when the record is created, so later changes to live
 * state cannot alter history. A {@code null} value means the key was absent.</p>
 *
 * @param key flat key or dot-joined nested path; never {@code null}
 * @param oldValue value before the change; may be {@code null}
 * @param newValue value after the change; may be {@code null}
 * @param timestamp time of the change; never {@code null}
 * @since 0.1.0
 */
public record StateChange(String key, Object oldValue, Object newValue, Instant timestamp) {

  public StateChange {
    key = Objects.requireNonNull(key, "key");
    timestamp = Objects.requireNonNull(timestamp, "timestamp");
    oldValue = JsonValues.frozenCopy(key, oldValue);
    newValue = JsonValues.frozenCopy(key, newValue);
  }

  public boolean isNested() {
    return StatePath.isNested(key);
  }
}
