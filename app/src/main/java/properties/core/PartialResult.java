package properties.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only view of the property values computed so far during one evaluation.
 *
 * <p>The view is backed by a map owned by the evaluation that created it, so it grows as
 * properties are bound. Clauses only ever read through it; use {@link #snapshot()} to keep a copy
 * that no longer changes.
 */
public final class PartialResult {
  private static final PartialResult EMPTY = new PartialResult(Map.of());

  private final Map<PropertyName, Object> values;

  private PartialResult(Map<PropertyName, Object> values) {
    this.values = Collections.unmodifiableMap(values);
  }

  /** Wraps an evaluation-local map. Writes to {@code backing} show through the view. */
  public static PartialResult viewOf(Map<PropertyName, Object> backing) {
    return new PartialResult(Objects.requireNonNull(backing, "backing"));
  }

  public static PartialResult empty() {
    return EMPTY;
  }

  public boolean contains(PropertyName name) {
    return values.containsKey(name);
  }

  public boolean contains(String name) {
    return contains(PropertyName.key(name));
  }

  public Optional<Object> find(PropertyName name) {
    return Optional.ofNullable(values.get(name));
  }

  /**
   * Returns the value bound to {@code name}.
   *
   * @throws IllegalStateException if the property has not been computed yet
   */
  public Object get(PropertyName name) {
    Object value = values.get(name);
    if (value == null) {
      throw new IllegalStateException("property " + name + " is not bound yet");
    }
    return value;
  }

  public Object get(String name) {
    return get(PropertyName.key(name));
  }

  public <T> T get(String name, Class<T> type) {
    Objects.requireNonNull(type, "type");
    Object value = get(name);
    if (!type.isInstance(value)) {
      throw new IllegalStateException(
          "property " + name + " holds " + value.getClass().getName() + ", not " + type.getName());
    }
    return type.cast(value);
  }

  public Set<PropertyName> boundNames() {
    return values.keySet();
  }

  public int size() {
    return values.size();
  }

  /** Copies the current bindings, in binding order. */
  public Map<PropertyName, Object> snapshot() {
    return Collections.unmodifiableMap(new LinkedHashMap<>(values));
  }

  @Override
  public String toString() {
    return values.toString();
  }
}
