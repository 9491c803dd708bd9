package properties.core;

import com.google.common.primitives.Primitives;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A property together with its ordered clauses.
 *
 * <p>{@code requiredNames} always contains the union of the clause requirements; extra names
 * passed in are kept as well. Clause order is significant: the first applicable clause wins. A
 * primitive value type is stored as its wrapper class.
 */
public record PropertyDeclaration<I>(
    PropertyName name,
    Class<?> valueType,
    List<Clause<I>> clauses,
    Set<PropertyName> requiredNames) {

  public PropertyDeclaration {
    Objects.requireNonNull(name, "name");
    valueType = valueType == null ? Object.class : Primitives.wrap(valueType);
    clauses = List.copyOf(Objects.requireNonNull(clauses, "clauses"));
    Set<PropertyName> union = new LinkedHashSet<>();
    if (requiredNames != null) {
      union.addAll(requiredNames);
    }
    for (Clause<I> clause : clauses) {
      union.addAll(clause.requiredNames());
    }
    requiredNames = Collections.unmodifiableSet(union);
  }

  public static <I> PropertyDeclaration<I> of(String name, List<Clause<I>> clauses) {
    return new PropertyDeclaration<>(PropertyName.of(name), Object.class, clauses, Set.of());
  }

  public static <I> Builder<I> builder(String name) {
    return new Builder<>(PropertyName.of(name));
  }

  public boolean hasDeclaredType() {
    return valueType != Object.class;
  }

  /** Appends the clauses and requirements of {@code other}, which must share this name. */
  public PropertyDeclaration<I> mergedWith(PropertyDeclaration<I> other) {
    Objects.requireNonNull(other, "other");
    if (!name.equals(other.name)) {
      throw new IllegalArgumentException("cannot merge " + name + " with " + other.name);
    }
    Class<?> type = valueType;
    if (other.hasDeclaredType()) {
      if (hasDeclaredType() && !valueType.equals(other.valueType)) {
        throw new IllegalArgumentException(
            "property "
                + name
                + " declared as both "
                + valueType.getName()
                + " and "
                + other.valueType.getName());
      }
      type = other.valueType;
    }
    List<Clause<I>> combined = new ArrayList<>(clauses);
    combined.addAll(other.clauses);
    Set<PropertyName> required = new LinkedHashSet<>(requiredNames);
    required.addAll(other.requiredNames);
    return new PropertyDeclaration<>(name, type, combined, required);
  }

  public static final class Builder<I> {
    private final PropertyName name;
    private final List<Clause<I>> clauses = new ArrayList<>();
    private final Set<PropertyName> requiredNames = new LinkedHashSet<>();
    private Class<?> valueType = Object.class;

    private Builder(PropertyName name) {
      this.name = name;
    }

    public Builder<I> type(Class<?> valueType) {
      this.valueType = Objects.requireNonNull(valueType, "valueType");
      return this;
    }

    public Builder<I> requires(String... names) {
      Arrays.stream(names).map(PropertyName::of).forEach(requiredNames::add);
      return this;
    }

    public Builder<I> clause(Clause<I> clause) {
      clauses.add(Objects.requireNonNull(clause, "clause"));
      return this;
    }

    /** Shorthand for an unconditional clause with no requirements. */
    public Builder<I> always(ClauseBody<I> body) {
      return clause(Clause.of(body));
    }

    public PropertyDeclaration<I> build() {
      return new PropertyDeclaration<>(name, valueType, clauses, requiredNames);
    }
  }
}
