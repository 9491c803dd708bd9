package properties.eval;

import java.util.List;
import java.util.Objects;
import properties.core.Clause;
import properties.core.PartialResult;
import properties.core.PropertyDeclaration;
import properties.core.error.ClauseExecutionException;
import properties.core.error.PropertyEngineException;

/** First-match selection among the clauses of one property. */
final class ClauseDispatcher {
  static final int NO_MATCH = -1;

  private ClauseDispatcher() {}

  /**
   * Returns the index of the first clause whose pattern and guard both hold, or {@link #NO_MATCH}.
   * Clauses after the selected one are never consulted.
   */
  static <I> int select(PropertyDeclaration<I> declaration, I input, PartialResult partial) {
    Objects.requireNonNull(declaration, "declaration");
    List<Clause<I>> clauses = declaration.clauses();
    for (int i = 0; i < clauses.size(); i++) {
      if (applies(declaration, i, input, partial)) {
        return i;
      }
    }
    return NO_MATCH;
  }

  private static <I> boolean applies(
      PropertyDeclaration<I> declaration, int index, I input, PartialResult partial) {
    try {
      return declaration.clauses().get(index).applies(input, partial);
    } catch (PropertyEngineException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      throw new ClauseExecutionException(declaration.name(), index, ex);
    }
  }
}
