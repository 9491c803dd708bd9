package properties.core;

/** Extra boolean condition over the input and the values bound so far. */
@FunctionalInterface
public interface ClauseGuard<I> {
  boolean test(I input, PartialResult partial);

  static <I> ClauseGuard<I> always() {
    return (input, partial) -> true;
  }
}
