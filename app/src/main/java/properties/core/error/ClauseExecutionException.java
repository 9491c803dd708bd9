package properties.core.error;

import java.util.Objects;
import properties.core.PropertyName;

/** Wraps an exception thrown by a clause pattern, guard or body. */
public final class ClauseExecutionException extends PropertyEngineException {
  private static final long serialVersionUID = 1L;

  private final transient PropertyName property;
  private final int clauseIndex;

  public ClauseExecutionException(PropertyName property, int clauseIndex, Throwable cause) {
    super(
        "clause #"
            + clauseIndex
            + " of property "
            + Objects.requireNonNull(property, "property")
            + " failed: "
            + cause.getMessage(),
        cause);
    this.property = property;
    this.clauseIndex = clauseIndex;
  }

  public PropertyName property() {
    return property;
  }

  public int clauseIndex() {
    return clauseIndex;
  }
}
