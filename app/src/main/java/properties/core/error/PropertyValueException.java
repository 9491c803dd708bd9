package properties.core.error;

import java.util.Objects;
import properties.core.PropertyName;

/** Raised when a clause body produces a null value or one outside the declared type. */
public final class PropertyValueException extends PropertyEngineException {
  private static final long serialVersionUID = 1L;

  private final transient PropertyName property;

  public PropertyValueException(PropertyName property, String message) {
    super("property " + Objects.requireNonNull(property, "property") + ": " + message);
    this.property = property;
  }

  public static PropertyValueException nullValue(PropertyName property, int clauseIndex) {
    return new PropertyValueException(property, "clause #" + clauseIndex + " returned null");
  }

  public static PropertyValueException wrongType(
      PropertyName property, Class<?> expected, Object value) {
    return new PropertyValueException(
        property,
        "expected "
            + expected.getName()
            + " but clause produced "
            + value.getClass().getName()
            + " ("
            + value
            + ")");
  }

  public PropertyName property() {
    return property;
  }
}
