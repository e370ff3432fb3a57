package ca.gc.cra.scribe.infrastructure.persistence;

import ca.gc.cra.scribe.application.port.StatePersistencePort;
import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link StatePersistencePort} storing the persistent state snapshot as a
 * pretty-printed JSON object.
 * <p><strong>Why:</strong> Keeps user preferences such as theme or last project human-readable and
 * diffable.</p>
 * <p><strong>Role:</strong> Infrastructure adapter wired by {@code CompositionRoot}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Parse the snapshot into maps, lists and scalars with the Jackson streaming API.</li>
 *   <li>Write through a sibling temp file and move it into place so readers never see a torn file.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless apart from the shared {@link JsonFactory}; safe to share.</p>
 *
 * @since 0.1.0
 */
public final class JsonStateFileAdapter implements StatePersistencePort {
  private static final Logger log = LoggerFactory.getLogger(JsonStateFileAdapter.class);

  private final JsonFactory factory = new JsonFactory();

  @Override
  public Optional<Map<String, Object>> read(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    if (!Files.exists(path)) {
      log.debug("No state snapshot at {}", path);
      return Optional.empty();
    }
    try (InputStream in = Files.newInputStream(path);
        JsonParser parser = factory.createParser(in)) {
      JsonToken token = parser.nextToken();
      if (token == null) {
        return Optional.of(Map.of());
      }
      if (token != JsonToken.START_OBJECT) {
        throw new IOException("State snapshot " + path + " must contain a JSON object, found " + token);
      }
      Map<String, Object> snapshot = readObject(parser);
      if (parser.nextToken() != null) {
        throw new IOException("State snapshot " + path + " contains trailing content");
      }
      return Optional.of(snapshot);
    } catch (JsonParseException ex) {
      throw new IOException("State snapshot " + path + " is not valid JSON", ex);
    }
  }

  @Override
  public void write(Path path, Map<String, Object> snapshot) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(snapshot, "snapshot");
    Path target = path.toAbsolutePath();
    Path parent = target.getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    Path temp = Files.createTempFile(parent, target.getFileName().toString(), ".tmp");
    try {
      try (OutputStream out = Files.newOutputStream(temp);
          JsonGenerator generator = factory.createGenerator(out, JsonEncoding.UTF8)) {
        generator.useDefaultPrettyPrinter();
        writeValue(generator, snapshot);
      }
      move(temp, target);
    } finally {
      Files.deleteIfExists(temp);
    }
    log.debug("Wrote {} persistent state keys to {}", snapshot.size(), target);
  }

  private static void move(Path source, Path target) throws IOException {
    try {
      Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } catch (AtomicMoveNotSupportedException ex) {
      log.debug("Atomic move unsupported for {}, falling back to replace", target);
      Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  private Object readValue(JsonParser parser, JsonToken token) throws IOException {
    return switch (token) {
      case START_OBJECT -> readObject(parser);
      case START_ARRAY -> readArray(parser);
      case VALUE_STRING -> parser.getText();
      case VALUE_NUMBER_INT -> parser.getNumberValue();
      case VALUE_NUMBER_FLOAT -> parser.getDoubleValue();
      case VALUE_TRUE -> Boolean.TRUE;
      case VALUE_FALSE -> Boolean.FALSE;
      case VALUE_NULL -> null;
      default -> throw new IOException("Unsupported JSON token: " + token);
    };
  }

  private Map<String, Object> readObject(JsonParser parser) throws IOException {
    Map<String, Object> map = new LinkedHashMap<>();
    while (true) {
      JsonToken token = parser.nextToken();
      if (token == JsonToken.END_OBJECT) {
        break;
      }
      if (token != JsonToken.FIELD_NAME) {
        throw new IOException("Expected field name but found " + token);
      }
      String fieldName = parser.currentName();
      map.put(fieldName, readValue(parser, parser.nextToken()));
    }
    return map;
  }

  private List<Object> readArray(JsonParser parser) throws IOException {
    List<Object> list = new ArrayList<>();
    while (true) {
      JsonToken token = parser.nextToken();
      if (token == JsonToken.END_ARRAY) {
        break;
      }
      list.add(readValue(parser, token));
    }
    return list;
  }

  private static void writeValue(JsonGenerator generator, Object value) throws IOException {
    if (value == null) {
      generator.writeNull();
    } else if (value instanceof String text) {
      generator.writeString(text);
    } else if (value instanceof Boolean flag) {
      generator.writeBoolean(flag);
    } else if (value instanceof Integer || value instanceof Long
        || value instanceof Short || value instanceof Byte) {
      generator.writeNumber(((Number) value).longValue());
    } else if (value instanceof java.math.BigInteger big) {
      generator.writeNumber(big);
    } else if (value instanceof java.math.BigDecimal decimal) {
      generator.writeNumber(decimal);
    } else if (value instanceof Number number) {
      generator.writeNumber(number.doubleValue());
    } else if (value instanceof Map<?, ?> map) {
      generator.writeStartObject();
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        generator.writeFieldName(String.valueOf(entry.getKey()));
        writeValue(generator, entry.getValue());
      }
      generator.writeEndObject();
    } else if (value instanceof Iterable<?> items) {
      generator.writeStartArray();
      for (Object item : items) {
        writeValue(generator, item);
      }
      generator.writeEndArray();
    } else {
      throw new IOException("Value of type " + value.getClass().getName() + " is not JSON-serializable");
    }
  }
}
