package properties.core.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import properties.core.PropertyName;

/** Raised when a property requires a name that no declaration provides. */
public final class UndeclaredPropertyException extends PropertyEngineException {
  private static final long serialVersionUID = 1L;

  private final transient Map<PropertyName, Set<PropertyName>> missing;

  /**
   * Both the offending properties and their missing names keep the order given.
   *
   * @param missing for each offending property, the required names that are not declared
   */
  public UndeclaredPropertyException(Map<PropertyName, Set<PropertyName>> missing) {
    super("undeclared properties referenced: " + Objects.requireNonNull(missing, "missing"));
    Map<PropertyName, Set<PropertyName>> copy = new LinkedHashMap<>();
    missing.forEach(
        (property, names) ->
            copy.put(property, Collections.unmodifiableSet(new LinkedHashSet<>(names))));
    this.missing = Collections.unmodifiableMap(copy);
  }

  /** Unmodifiable, in the order the offending properties were declared. */
  public Map<PropertyName, Set<PropertyName>> missing() {
    return missing;
  }
}
