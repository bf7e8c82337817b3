package cafe.woden.linkvault.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Converts model records to and from snake_case rows (remote tables, change-feed payloads) and JSON
 * documents (local storage).
 */
public final class RowCodec {

  private static final TypeReference<Map<String, Object>> ROW = new TypeReference<>() {};

  private final ObjectMapper mapper;

  public RowCodec() {
    this.mapper = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
  }

  public Map<String, Object> toRow(Object record) {
    return mapper.convertValue(record, ROW);
  }

  /** @throws IllegalArgumentException if the row cannot be bound to {@code type} */
  public <T> T fromRow(Map<String, ?> row, Class<T> type) {
    return mapper.convertValue(row, type);
  }

  public String toJson(Collection<?> records) {
    try {
      return mapper.writeValueAsString(records);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Could not encode " + records.size() + " records", e);
    }
  }

  public String toJson(Object record) {
    try {
      return mapper.writeValueAsString(record);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Could not encode " + record, e);
    }
  }

  public <T> T readJson(String json, Class<T> type) {
    try {
      return mapper.readValue(json, type);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Could not decode " + type.getSimpleName(), e);
    }
  }

  public <T> List<T> readJsonList(String json, Class<T> type) {
    if (json == null || json.isBlank()) return new ArrayList<>();
    try {
      return mapper.readValue(json,
          mapper.getTypeFactory().constructCollectionType(ArrayList.class, type));
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Could not decode list of " + type.getSimpleName(), e);
    }
  }
}
