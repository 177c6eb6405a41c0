package io.studentdeals.platform.audit;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Turns arbitrary values (request bodies, DTOs, entities) into detached JSON-shaped maps suitable
 * for the {@code old_values} / {@code new_values} columns. The copy goes through Jackson, so later
 * mutation of the source object graph cannot reach a stored entry.
 */
@Component
public class AuditValueSnapshots {

  static final String MASK = "***MASKED***";
  static final String SCALAR_KEY = "value";

  private final ObjectMapper objectMapper;
  private final Set<String> maskedFields;

  public AuditValueSnapshots(ObjectMapper objectMapper, AuditProperties properties) {
    this.objectMapper = objectMapper;
    this.maskedFields =
        properties.maskedFields().stream()
            .map(field -> field.toLowerCase(Locale.ROOT))
            .collect(Collectors.toUnmodifiableSet());
  }

  /**
   * Returns a masked deep copy of {@code value}, or null for null input. Non-object values (lists,
   * scalars) are wrapped under a single {@code "value"} key.
   *
   * @throws IllegalArgumentException if the value cannot be serialized
   */
  public Map<String, Object> snapshot(Object value) {
    Map<String, Object> tree = toTree(value);
    return tree == null ? null : maskMap(tree);
  }

  /**
   * Unmasked deep copy, used to read identifiers out of operation results.
   *
   * @throws IllegalArgumentException if the value cannot be serialized
   */
  @SuppressWarnings("unchecked")
  public Map<String, Object> toTree(Object value) {
    if (value == null) {
      return null;
    }
    Object converted = objectMapper.convertValue(value, Object.class);
    if (converted instanceof Map<?, ?> map) {
      return (Map<String, Object>) map;
    }
    var wrapped = new LinkedHashMap<String, Object>();
    wrapped.put(SCALAR_KEY, converted);
    return wrapped;
  }

  private Map<String, Object> maskMap(Map<String, Object> source) {
    var masked = new LinkedHashMap<String, Object>();
    source.forEach(
        (key, value) -> {
          if (key != null && maskedFields.contains(key.toLowerCase(Locale.ROOT))) {
            masked.put(key, MASK);
          } else {
            masked.put(key, maskValue(value));
          }
        });
    return masked;
  }

  @SuppressWarnings("unchecked")
  private Object maskValue(Object value) {
    if (value instanceof Map<?, ?> map) {
      return maskMap((Map<String, Object>) map);
    }
    if (value instanceof List<?> list) {
      var copy = new ArrayList<Object>(list.size());
      list.forEach(item -> copy.add(maskValue(item)));
      return copy;
    }
    return value;
  }
}
