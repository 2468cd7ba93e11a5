package eventrelay.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link JsonCodec} backed by a Jackson {@link ObjectMapper}.
 *
 * <p>Thread-safe; the mapper is configured once and shared.
 */
public final class JacksonJsonCodec implements JsonCodec {

  static final JacksonJsonCodec INSTANCE = new JacksonJsonCodec(new ObjectMapper());

  private static final TypeReference<LinkedHashMap<String, Object>> OBJECT_TYPE =
      new TypeReference<>() {};
  private static final TypeReference<LinkedHashMap<String, String>> STRING_MAP_TYPE =
      new TypeReference<>() {};
  private static final TypeReference<List<String>> STRING_LIST_TYPE = new TypeReference<>() {};

  private final ObjectMapper mapper;

  public JacksonJsonCodec(ObjectMapper mapper) {
    this.mapper = mapper;
  }

  @Override
  public String toJson(Object value) {
    try {
      return mapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Value is not JSON serializable: " + e.getOriginalMessage(), e);
    }
  }

  @Override
  public Map<String, Object> parseObject(String json) {
    if (isAbsent(json)) {
      return Collections.emptyMap();
    }
    return read(json, OBJECT_TYPE);
  }

  @Override
  public Map<String, String> parseStringMap(String json) {
    if (isAbsent(json)) {
      return Collections.emptyMap();
    }
    return read(json, STRING_MAP_TYPE);
  }

  @Override
  public List<String> parseStringList(String json) {
    if (isAbsent(json)) {
      return Collections.emptyList();
    }
    return read(json, STRING_LIST_TYPE);
  }

  private <T> T read(String json, TypeReference<T> type) {
    try {
      return mapper.readValue(json, type);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Invalid JSON: " + e.getOriginalMessage(), e);
    }
  }

  private static boolean isAbsent(String json) {
    return json == null || json.isBlank() || "null".equals(json.trim());
  }
}
