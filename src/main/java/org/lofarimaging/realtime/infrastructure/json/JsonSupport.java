package org.lofarimaging.realtime.infrastructure.json;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Minimal JSON helper that parses documents into {@link Map}/{@link List} structures and writes files
 * atomically.
 *
 * @since 0.1.0
 */
public final class JsonSupport {
  private final JsonFactory factory = new JsonFactory();

  public JsonFactory factory() {
    return factory;
  }

  /**
   * Parses the supplied JSON string into an object graph of maps, lists, and primitives.
   *
   * @param json JSON document; never {@code null}
   * @return parsed object graph
   * @throws IOException when the document is malformed
   */
  public Object parse(String json) throws IOException {
    Objects.requireNonNull(json, "json");
    try (JsonParser parser = factory.createParser(json)) {
      JsonToken token = parser.nextToken();
      if (token == null) {
        throw new IOException("Empty JSON document");
      }
      Object value = readValue(parser, token);
      JsonToken trailing = parser.nextToken();
      if (trailing != null && trailing != JsonToken.NOT_AVAILABLE) {
        throw new IOException("JSON document contains trailing content");
      }
      return value;
    }
  }

  /**
   * Writes {@code content} to a sibling temporary file and moves it over {@code target}, so readers never see
   * a half-written document.
   *
   * @param target destination file
   * @param content UTF-8 bytes to write
   * @throws IOException if writing or moving fails
   */
  public static void writeAtomically(Path target, byte[] content) throws IOException {
    Objects.requireNonNull(target, "target");
    Path absolute = target.toAbsolutePath();
    Path temp = absolute.resolveSibling(absolute.getFileName() + ".tmp");
    Files.write(temp, content);
    try {
      Files.move(temp, absolute, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } catch (AtomicMoveNotSupportedException ex) {
      Files.move(temp, absolute, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  /**
   * Reads a numeric field as a {@code double}.
   *
   * @param object parsed JSON object
   * @param field field name
   * @return value, or {@code null} when absent or {@code null}
   * @throws IOException if the value is not a number
   */
  public static Double optionalDouble(Map<String, Object> object, String field) throws IOException {
    Object value = object.get(field);
    if (value == null) {
      return null;
    }
    if (value instanceof Number number) {
      return number.doubleValue();
    }
    throw new IOException("Field '" + field + "' is not a number: " + value);
  }

  /**
   * Reads a numeric field that must be present.
   *
   * @param object parsed JSON object
   * @param field field name
   * @return value
   * @throws IOException if the field is missing or not a number
   */
  public static double requiredDouble(Map<String, Object> object, String field) throws IOException {
    Double value = optionalDouble(object, field);
    if (value == null) {
      throw new IOException("Missing field '" + field + "'");
    }
    return value;
  }

  /**
   * Casts a parsed value to a JSON object.
   *
   * @param value parsed value
   * @param what description used in the error message
   * @return object view
   * @throws IOException if the value is not an object
   */
  @SuppressWarnings("unchecked")
  public static Map<String, Object> asObject(Object value, String what) throws IOException {
    if (value instanceof Map<?, ?>) {
      return (Map<String, Object>) value;
    }
    throw new IOException(what + " is not a JSON object");
  }

  private Object readValue(JsonParser parser, JsonToken token) throws IOException {
    return switch (token) {
      case START_OBJECT -> readObject(parser);
      case START_ARRAY -> readArray(parser);
      case VALUE_STRING -> parser.getText();
      case VALUE_NUMBER_INT, VALUE_NUMBER_FLOAT -> parser.getNumberValue();
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
      String fieldName = parser.getCurrentName();
      JsonToken valueToken = parser.nextToken();
      map.put(fieldName, readValue(parser, valueToken));
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
}
