package properties.core.error;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import properties.core.PropertyName;

/** Raised at schema construction when the declared dependencies contain a cycle. */
public final class CyclicDependencyException extends PropertyEngineException {
  private static final long serialVersionUID = 1L;

  private final transient Set<PropertyName> cycleMembers;

  public CyclicDependencyException(Set<PropertyName> cycleMembers) {
    super(
        "dependency cycle among properties "
            + Objects.requireNonNull(cycleMembers, "cycleMembers"));
    if (cycleMembers.isEmpty()) {
      throw new IllegalArgumentException("cycleMembers must not be empty");
    }
    this.cycleMembers = Collections.unmodifiableSet(new LinkedHashSet<>(cycleMembers));
  }

  /** Every property that lies on some cycle, in declaration order. */
  public Set<PropertyName> cycleMembers() {
    return cycleMembers;
  }
}
