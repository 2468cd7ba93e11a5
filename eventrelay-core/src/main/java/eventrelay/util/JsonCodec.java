package eventrelay.util;

import java.util.List;
import java.util.Map;

/**
 * JSON encoding of payloads, metadata, header maps and webhook bodies.
 *
 * <p>The default implementation ({@link JacksonJsonCodec}) delegates to a shared Jackson
 * {@code ObjectMapper}. Encoding preserves map insertion order, which the webhook body relies on.
 *
 * @see #getDefault()
 */
public interface JsonCodec {

  /**
   * Returns the default singleton implementation.
   *
   * @return the default {@link JsonCodec}
   */
  static JsonCodec getDefault() {
    return JacksonJsonCodec.INSTANCE;
  }

  /**
   * Encodes a value (maps, lists, strings, numbers, booleans) as compact JSON.
   *
   * @param value the value to encode, may be {@code null}
   * @return JSON text, {@code "null"} for a null value
   * @throws IllegalArgumentException if the value cannot be serialized
   */
  String toJson(Object value);

  /**
   * Parses a JSON object. Returns an empty map for {@code null}, empty or {@code "null"} input.
   *
   * @throws IllegalArgumentException if the input is not a JSON object
   */
  Map<String, Object> parseObject(String json);

  /**
   * Parses a flat JSON object of string values, e.g. HTTP headers.
   *
   * @throws IllegalArgumentException if the input is not a JSON object
   */
  Map<String, String> parseStringMap(String json);

  /**
   * Parses a JSON array of strings. Returns an empty list for {@code null} or empty input.
   *
   * @throws IllegalArgumentException if the input is not a JSON array
   */
  List<String> parseStringList(String json);
}
