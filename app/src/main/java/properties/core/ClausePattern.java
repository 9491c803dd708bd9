package properties.core;

/** Tests whether the partial result has the shape a clause expects. */
@FunctionalInterface
public interface ClausePattern {
  boolean matches(PartialResult partial);

  default ClausePattern and(ClausePattern other) {
    return partial -> matches(partial) && other.matches(partial);
  }
}
