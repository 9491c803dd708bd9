package properties.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Completed evaluation: exactly one value per declared property, ordered by declaration.
 * Equality is by content, independent of order.
 */
public final class ResultRecord {
  private final Map<PropertyName, Object> values;

  private ResultRecord(Map<PropertyName, Object> values) {
    this.values = values;
  }

  /**
   * Builds a record from the bindings of a finished evaluation, laid out in {@code fieldOrder}.
   *
   * @throws IllegalArgumentException if the bindings and the field list disagree
   */
  public static ResultRecord of(Map<PropertyName, Object> bindings, List<PropertyName> fieldOrder) {
    Objects.requireNonNull(bindings, "bindings");
    Objects.requireNonNull(fieldOrder, "fieldOrder");
    if (bindings.size() != fieldOrder.size()) {
      throw new IllegalArgumentException(
          "expected " + fieldOrder.size() + " values but got " + bindings.size());
    }
    Map<PropertyName, Object> ordered = new LinkedHashMap<>();
    for (PropertyName name : fieldOrder) {
      Object value = bindings.get(name);
      if (value == null) {
        throw new IllegalArgumentException("missing value for property " + name);
      }
      ordered.put(name, value);
    }
    return new ResultRecord(Collections.unmodifiableMap(ordered));
  }

  public Object get(PropertyName name) {
    Object value = values.get(name);
    if (value == null) {
      throw new NoSuchElementException("unknown property " + name);
    }
    return value;
  }

  public Object get(String name) {
    return get(PropertyName.key(name));
  }

  /**
   * Returns the value of {@code name} as {@code type}.
   *
   * @throws IllegalStateException if the value is not an instance of {@code type}
   */
  public <T> T get(String name, Class<T> type) {
    Objects.requireNonNull(type, "type");
    Object value = get(name);
    if (!type.isInstance(value)) {
      throw new IllegalStateException(
          "property " + name + " holds " + value.getClass().getName() + ", not " + type.getName());
    }
    return type.cast(value);
  }

  public boolean has(String name) {
    return values.containsKey(PropertyName.key(name));
  }

  public List<PropertyName> names() {
    return List.copyOf(values.keySet());
  }

  public int size() {
    return values.size();
  }

  public Map<PropertyName, Object> asMap() {
    return values;
  }

  /** Same contents keyed by plain strings, convenient for reporting. */
  public Map<String, Object> toStringKeyedMap() {
    Map<String, Object> out = new LinkedHashMap<>();
    values.forEach((name, value) -> out.put(name.value(), value));
    return out;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ResultRecord other)) {
      return false;
    }
    return values.equals(other.values);
  }

  @Override
  public int hashCode() {
    return values.hashCode();
  }

  @Override
  public String toString() {
    return values.toString();
  }
}
