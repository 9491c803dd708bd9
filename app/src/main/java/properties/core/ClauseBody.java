package properties.core;

/**
 * Computes a property value. Implementations must be pure in {@code (input, partial)}: a schema is
 * shared between evaluations and its bodies may run concurrently.
 */
@FunctionalInterface
public interface ClauseBody<I> {
  Object apply(I input, PartialResult partial);
}
