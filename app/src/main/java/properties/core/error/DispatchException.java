package properties.core.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import properties.core.PropertyName;

/**
 * Raised when no clause of a property applies to the partial result reached during an evaluation.
 */
public final class DispatchException extends PropertyEngineException {
  private static final long serialVersionUID = 1L;

  private final transient PropertyName property;
  private final transient Map<PropertyName, Object> partialSnapshot;

  public DispatchException(PropertyName property, Map<PropertyName, Object> partialSnapshot) {
    super(
        "no clause of property "
            + Objects.requireNonNull(property, "property")
            + " matches partial result "
            + partialSnapshot);
    this.property = property;
    this.partialSnapshot = Collections.unmodifiableMap(new LinkedHashMap<>(partialSnapshot));
  }

  public PropertyName property() {
    return property;
  }

  /** Values that were bound when dispatch failed. */
  public Map<PropertyName, Object> partialSnapshot() {
    return partialSnapshot;
  }
}
