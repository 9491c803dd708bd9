package properties.core;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * One guarded alternative for computing a property.
 *
 * <p>{@code requiredNames} lists every other property the pattern or guard reads. The engine does
 * not derive it; whoever builds the clause states it.
 */
public record Clause<I>(
    ClausePattern pattern,
    ClauseGuard<I> guard,
    ClauseBody<I> body,
    Set<PropertyName> requiredNames) {

  public Clause {
    Objects.requireNonNull(pattern, "pattern");
    Objects.requireNonNull(guard, "guard");
    Objects.requireNonNull(body, "body");
    requiredNames =
        requiredNames == null
            ? Set.of()
            : Collections.unmodifiableSet(new LinkedHashSet<>(requiredNames));
  }

  /** Unconditional clause that reads nothing from the partial result. */
  public static <I> Clause<I> of(ClauseBody<I> body) {
    return new Clause<>(Patterns.any(), ClauseGuard.always(), body, Set.of());
  }

  public static <I> Builder<I> builder() {
    return new Builder<>();
  }

  /** Whether this clause applies to the given input and partial result. */
  public boolean applies(I input, PartialResult partial) {
    return pattern.matches(partial) && guard.test(input, partial);
  }

  /** Fluent construction that records required names alongside the pattern that reads them. */
  public static final class Builder<I> {
    private final Set<PropertyName> requiredNames = new LinkedHashSet<>();
    private ClausePattern pattern = Patterns.any();
    private ClauseGuard<I> guard = ClauseGuard.always();

    private Builder() {}

    public Builder<I> requires(String... names) {
      Arrays.stream(names).map(PropertyName::of).forEach(requiredNames::add);
      return this;
    }

    public Builder<I> pattern(ClausePattern pattern) {
      this.pattern = this.pattern.and(Objects.requireNonNull(pattern, "pattern"));
      return this;
    }

    public Builder<I> whenBound(String name) {
      requires(name);
      return pattern(Patterns.bound(name));
    }

    public Builder<I> whenEqual(String name, Object expected) {
      requires(name);
      return pattern(Patterns.equalTo(name, expected));
    }

    public Builder<I> guard(ClauseGuard<I> guard) {
      this.guard = Objects.requireNonNull(guard, "guard");
      return this;
    }

    public Clause<I> body(ClauseBody<I> body) {
      return new Clause<>(pattern, guard, body, requiredNames);
    }
  }
}
