package properties.eval;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import properties.core.PropertyName;
import properties.core.ResultRecord;

/**
 * Outcome of one successful evaluation.
 *
 * @param record the computed values
 * @param selectedClauses index of the clause that produced each property, in evaluation order;
 *     empty when tracing is off
 * @param elapsedMicros wall time spent in the evaluation
 */
public record EvaluationRun(
    ResultRecord record, Map<PropertyName, Integer> selectedClauses, long elapsedMicros) {

  public EvaluationRun {
    Objects.requireNonNull(record, "record");
    selectedClauses =
        selectedClauses == null || selectedClauses.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(selectedClauses));
  }

  public boolean hasTrace() {
    return !selectedClauses.isEmpty();
  }

  /** Clause index chosen for {@code name}, or -1 when it was not traced. */
  public int selectedClause(String name) {
    return selectedClauses.getOrDefault(PropertyName.key(name), -1);
  }
}
