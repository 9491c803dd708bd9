package properties.eval;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import properties.core.Clause;
import properties.core.PartialResult;
import properties.core.PropertyDeclaration;
import properties.core.PropertyName;
import properties.core.ResultRecord;
import properties.core.error.ClauseExecutionException;
import properties.core.error.DispatchException;
import properties.core.error.PropertyEngineException;
import properties.core.error.PropertyValueException;
import properties.schema.Schema;
import properties.util.Timing;

/**
 * Computes every property of a {@link Schema} for one input.
 *
 * <p>Properties are visited in the schema's evaluation order. For each one the first applicable
 * clause is selected against the values bound so far, its body is invoked, and the result is bound
 * under the property name. A failure at any step aborts the whole evaluation; callers never see a
 * partially filled record.
 *
 * <p>All state of an evaluation lives on the calling thread, so one evaluator and one schema can
 * serve concurrent calls.
 */
public final class Evaluator<I> {
  private static final Logger LOG = LoggerFactory.getLogger(Evaluator.class);

  private final EvaluationOptions options;

  public Evaluator() {
    this(EvaluationOptions.defaults());
  }

  public Evaluator(EvaluationOptions options) {
    this.options = EvaluationOptions.normalize(options);
  }

  public EvaluationOptions options() {
    return options;
  }

  /**
   * @throws DispatchException if some property has no applicable clause
   * @throws PropertyValueException if a body returns null or a value of the wrong type
   * @throws ClauseExecutionException if a pattern, guard or body throws
   */
  public ResultRecord evaluate(Schema<I> schema, I input) {
    return run(schema, input).record();
  }

  /** Like {@link #evaluate} but also reports which clause produced each value. */
  public EvaluationRun run(Schema<I> schema, I input) {
    Objects.requireNonNull(schema, "schema");
    Timing timing = Timing.start();
    Map<PropertyName, Object> bindings = new LinkedHashMap<>();
    Map<PropertyName, Integer> selected = new LinkedHashMap<>();
    PartialResult partial = PartialResult.viewOf(bindings);

    for (PropertyName name : schema.evaluationOrder()) {
      PropertyDeclaration<I> declaration = schema.declaration(name);
      int clauseIndex = ClauseDispatcher.select(declaration, input, partial);
      if (clauseIndex == ClauseDispatcher.NO_MATCH) {
        LOG.debug("No clause of {} matched {}", name, partial);
        throw new DispatchException(name, partial.snapshot());
      }

      Object value = invoke(declaration, clauseIndex, input, partial);
      if (bindings.putIfAbsent(name, value) != null) {
        throw new IllegalStateException("property " + name + " bound twice");
      }
      if (options.recordTrace()) {
        selected.put(name, clauseIndex);
      }
      LOG.trace("{} = {} (clause #{})", name, value, clauseIndex);
    }

    ResultRecord record = ResultRecord.of(bindings, schema.names());
    return new EvaluationRun(record, selected, timing.elapsedMicros());
  }

  private Object invoke(
      PropertyDeclaration<I> declaration, int clauseIndex, I input, PartialResult partial) {
    Clause<I> clause = declaration.clauses().get(clauseIndex);
    Object value;
    try {
      value = clause.body().apply(input, partial);
    } catch (PropertyEngineException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      throw new ClauseExecutionException(declaration.name(), clauseIndex, ex);
    }
    if (value == null) {
      throw PropertyValueException.nullValue(declaration.name(), clauseIndex);
    }
    if (options.verifyValueTypes() && !declaration.valueType().isInstance(value)) {
      throw PropertyValueException.wrongType(declaration.name(), declaration.valueType(), value);
    }
    return value;
  }
}
