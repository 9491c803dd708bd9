package properties.core;

import java.util.Objects;
import java.util.function.Predicate;

/** Common {@link ClausePattern}s over a partial result. */
public final class Patterns {
  private static final ClausePattern ANY = partial -> true;

  private Patterns() {}

  /** Matches every partial result (the wildcard pattern). */
  public static ClausePattern any() {
    return ANY;
  }

  /** Matches once {@code name} has a value. */
  public static ClausePattern bound(String name) {
    PropertyName property = PropertyName.of(name);
    return partial -> partial.contains(property);
  }

  /** Matches when {@code name} is bound and equal to {@code expected}. */
  public static ClausePattern equalTo(String name, Object expected) {
    Objects.requireNonNull(expected, "expected");
    PropertyName property = PropertyName.of(name);
    return partial -> partial.find(property).map(expected::equals).orElse(false);
  }

  /** Matches when {@code name} is bound and its value satisfies {@code test}. */
  public static ClausePattern matches(String name, Predicate<Object> test) {
    Objects.requireNonNull(test, "test");
    PropertyName property = PropertyName.of(name);
    return partial -> partial.find(property).map(test::test).orElse(false);
  }

  public static ClausePattern allOf(ClausePattern... patterns) {
    ClausePattern combined = ANY;
    for (ClausePattern pattern : patterns) {
      combined = combined.and(Objects.requireNonNull(pattern, "pattern"));
    }
    return combined;
  }
}
