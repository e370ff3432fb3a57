package ca.gc.cra.scribe.application.port;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/**
 * <strong>What:</strong> Port that reads and writes the persistent state snapshot.
 * <p><strong>Why:</strong> Keeps the state manager free of file-format details and lets tests substitute
 * in-memory stores.</p>
 * <p><strong>Role:</strong> Application port implemented by {@code JsonStateFileAdapter}.</p>
 * <p><strong>Contract:</strong> A snapshot is one JSON object mapping persistent key to value. Every write
 * replaces the whole snapshot.</p>
 *
 * @since 0.1.0
 */
public interface StatePersistencePort {
  /**
   * Reads the snapshot at {@code path}.
   *
   * @param path snapshot location; never {@code null}
   * @return the stored key/value pairs, or empty when no snapshot exists
   * @throws IOException when the snapshot exists but cannot be read or parsed
   */
  Optional<Map<String, Object>> read(Path path) throws IOException;

  /**
   * Replaces the snapshot at {@code path}, creating parent directories as needed.
   *
   * @param path snapshot location; never {@code null}
   * @param snapshot persistent key/value pairs in iteration order; never {@code null}
   * @throws IOException when the snapshot cannot be written
   */
  void write(Path path, Map<String, Object> snapshot) throws IOException;
}
