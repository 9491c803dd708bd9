package properties.graph;

import java.util.Objects;
import properties.core.PropertyName;

/** Edge {@code from -> to}: {@code from} must be computed before {@code to}. */
public record DependencyEdge(PropertyName from, PropertyName to) {

  public DependencyEdge {
    Objects.requireNonNull(from, "from");
    Objects.requireNonNull(to, "to");
  }

  public boolean isSelfLoop() {
    return from.equals(to);
  }

  @Override
  public String toString() {
    return from + " -> " + to;
  }
}
