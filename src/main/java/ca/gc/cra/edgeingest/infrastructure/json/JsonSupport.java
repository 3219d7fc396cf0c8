package ca.gc.cra.edgeingest.infrastructure.json;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Minimal JSON reader that parses documents into {@link Map}/{@link List} structures, plus typed accessors for
 * reading them back.
 *
 * @since 0.1.0
 */
public final class JsonSupport {
  private final JsonFactory factory;

  /** Creates a reader with a private {@link JsonFactory}. */
  public JsonSupport() {
    this(new JsonFactory());
  }

  /**
   * Creates a reader sharing {@code factory}.
   *
   * @param factory Jackson streaming factory
   */
  public JsonSupport(JsonFactory factory) {
    this.factory = Objects.requireNonNull(factory, "factory");
  }

  /**
   * Parses a JSON document into an object graph of maps, lists, and primitives.
   *
   * @param json JSON document; never {@code null}
   * @return parsed object graph; an empty map for an empty document
   * @throws IllegalArgumentException when parsing fails or trailing content follows the document
   */
  public Object parse(String json) {
    Objects.requireNonNull(json, "json");
    try (JsonParser parser = factory.createParser(json)) {
      JsonToken token = parser.nextToken();
      if (token == null) {
        return Map.of();
      }
      Object value = readValue(parser, token);
      JsonToken trailing = parser.nextToken();
      if (trailing != null && trailing != JsonToken.NOT_AVAILABLE) {
        throw new IllegalArgumentException("JSON document contains trailing content");
      }
      return value;
    } catch (IOException ex) {
      throw new IllegalArgumentException("Invalid JSON payload", ex);
    }
  }

  /**
   * Casts a parsed node to an object.
   *
   * @param node parsed node
   * @param context name used in error messages
   * @return node as a map
   * @throws IllegalArgumentException if the node is not a JSON object
   */
  @SuppressWarnings("unchecked")
  public static Map<String, Object> asObject(Object node, String context) {
    if (!(node instanceof Map<?, ?>)) {
      throw new IllegalArgumentException(context + " must be a JSON object");
    }
    return (Map<String, Object>) node;
  }

  /**
   * Casts a parsed node to an array.
   *
   * @param node parsed node; {@code null} yields an empty list
   * @param context name used in error messages
   * @return node as a list
   * @throws IllegalArgumentException if the node is neither {@code null} nor a JSON array
   */
  public static List<Object> asArray(Object node, String context) {
    if (node == null) {
      return List.of();
    }
    if (!(node instanceof List<?> list)) {
      throw new IllegalArgumentException(context + " must be a JSON array");
    }
    return new ArrayList<>(list);
  }

  /**
   * Reads an integral field.
   *
   * @param object parsed object
   * @param field field name
   * @return value, or {@code null} when absent or JSON {@code null}
   * @throws IllegalArgumentException if the value is present but not an integer
   */
  public static Long optionalLong(Map<String, Object> object, String field) {
    Object value = object.get(field);
    if (value == null) {
      return null;
    }
    if (value instanceof Integer || value instanceof Long) {
      return ((Number) value).longValue();
    }
    if (value instanceof BigInteger big) {
      return big.longValueExact();
    }
    throw new IllegalArgumentException(field + " must be an integer");
  }

  /**
   * Reads an integral field with a fallback.
   *
   * @param object parsed object
   * @param field field name
   * @param fallback value used when the field is absent
   * @return value or {@code fallback}
   */
  public static long longOr(Map<String, Object> object, String field, long fallback) {
    Long value = optionalLong(object, field);
    return value == null ? fallback : value;
  }

  /**
   * Reads a string field.
   *
   * @param object parsed object
   * @param field field name
   * @return value, or {@code null} when absent or JSON {@code null}
   * @throws IllegalArgumentException if the value is present but not a string
   */
  public static String optionalString(Map<String, Object> object, String field) {
    Object value = object.get(field);
    if (value == null) {
      return null;
    }
    if (!(value instanceof String text)) {
      throw new IllegalArgumentException(field + " must be a string");
    }
    return text;
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
      default -> throw new IllegalArgumentException("Unsupported JSON token: " + token);
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
        throw new IllegalArgumentException("Expected field name but found " + token);
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
