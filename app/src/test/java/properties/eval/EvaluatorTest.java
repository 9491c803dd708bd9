package properties.eval;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.junit.jupiter.api.Test;
import properties.core.Clause;
import properties.core.PropertyName;
import properties.core.ResultRecord;
import properties.core.error.ClauseExecutionException;
import properties.core.error.DispatchException;
import properties.core.error.PropertyValueException;
import properties.examples.ExampleSchemas;
import properties.schema.Schema;

final class EvaluatorTest {

  @Test
  void firstMatchingClauseWins() {
    EvaluationRun run = new Evaluator<Integer>().run(ExampleSchemas.arithmetic(), 2);

    assertEquals(Map.of("p", 3, "q", 10, "r", 30, "z", 50), run.record().toStringKeyedMap());
    assertEquals(0, run.selectedClause("q"), "Guard p > 0 is tried before pattern p == 3");
  }

  @Test
  void fallbackClauseRunsWhenEarlierOnesDoNotApply() {
    // p = -2 for input -3: guard p > 0 fails, p != 3, so p * i applies
    ResultRecord record = new Evaluator<Integer>().evaluate(ExampleSchemas.arithmetic(), -3);

    assertEquals(-2, record.get("p", Integer.class));
    assertEquals(6, record.get("q", Integer.class));
    assertEquals(30, record.get("z", Integer.class));
    assertEquals(-12, record.get("r", Integer.class));
  }

  @Test
  void clausesSeeExactlyThePropertiesEvaluatedBeforeThem() {
    Map<String, Set<PropertyName>> seen = new ConcurrentHashMap<>();
    Schema<Integer> schema =
        Schema.<Integer>builder()
            .property("late", late -> late.always((i, r) -> remember(seen, "late", r.boundNames())))
            .property(
                "needsBoth",
                both ->
                    both.clause(
                        Clause.<Integer>builder()
                            .requires("base", "late")
                            .body((i, r) -> remember(seen, "needsBoth", r.boundNames()))))
            .property("base", base -> base.always((i, r) -> remember(seen, "base", r.boundNames())))
            .build();

    ResultRecord result = schema.evaluate(1);

    assertEquals(3, result.size(), "Every declared property is present");
    assertEquals(Set.of(), seen.get("late"));
    assertEquals(
        Set.of(PropertyName.of("late"), PropertyName.of("base")),
        seen.get("needsBoth"),
        "Requirements are bound before the dependent runs");
    assertFalse(
        seen.get("base").contains(PropertyName.of("needsBoth")),
        "Properties later in the order are never visible");
  }

  @Test
  void nonExhaustiveClausesRaiseDispatchException() {
    Schema<Integer> schema =
        Schema.<Integer>builder()
            .property("p", p -> p.always((i, r) -> i + 1))
            .property(
                "q",
                q ->
                    q.clause(Clause.<Integer>builder().whenEqual("p", 3).body((i, r) -> i * 5))
                        .clause(
                            Clause.<Integer>builder()
                                .whenEqual("p", 3)
                                .guard((i, r) -> i > 0)
                                .body((i, r) -> i)))
            .build();

    assertEquals(10, schema.evaluate(2).get("q", Integer.class));
    DispatchException ex = assertThrows(DispatchException.class, () -> schema.evaluate(3));

    assertEquals(PropertyName.of("q"), ex.property());
    assertEquals(Map.of(PropertyName.of("p"), 4), ex.partialSnapshot());
  }

  @Test
  void nullValueIsRejected() {
    Schema<Integer> schema =
        Schema.<Integer>builder().property("p", p -> p.always((i, r) -> null)).build();

    PropertyValueException ex =
        assertThrows(PropertyValueException.class, () -> schema.evaluate(1));

    assertEquals(PropertyName.of("p"), ex.property());
  }

  @Test
  void declaredTypeIsVerifiedUnlessDisabled() {
    Schema<Integer> schema =
        Schema.<Integer>builder()
            .property("p", p -> p.type(String.class).always((i, r) -> i))
            .build();

    assertThrows(PropertyValueException.class, () -> schema.evaluate(1));
    ResultRecord lenient =
        new Evaluator<Integer>(EvaluationOptions.defaults().withVerifyValueTypes(false))
            .evaluate(schema, 1);
    assertEquals(1, lenient.get("p"));
  }

  @Test
  void bodyFailureIsWrappedWithClauseIndex() {
    Schema<Integer> schema =
        Schema.<Integer>builder()
            .property(
                "p",
                p ->
                    p.clause(Clause.<Integer>builder().guard((i, r) -> i < 0).body((i, r) -> 0))
                        .always((i, r) -> 10 / i))
            .build();

    ClauseExecutionException ex =
        assertThrows(ClauseExecutionException.class, () -> schema.evaluate(0));

    assertEquals(1, ex.clauseIndex());
    assertEquals(PropertyName.of("p"), ex.property());
    assertInstanceOf(ArithmeticException.class, ex.getCause());
  }

  @Test
  void guardFailureIsWrapped() {
    Schema<Integer> schema =
        Schema.<Integer>builder()
            .property(
                "p",
                p ->
                    p.clause(
                        Clause.<Integer>builder()
                            .guard(
                                (i, r) -> {
                                  throw new IllegalStateException("boom");
                                })
                            .body((i, r) -> 0)))
            .build();

    ClauseExecutionException ex =
        assertThrows(ClauseExecutionException.class, () -> schema.evaluate(1));

    assertEquals(0, ex.clauseIndex());
  }

  @Test
  void repeatedEvaluationIsDeterministic() {
    Schema<Integer> schema = ExampleSchemas.arithmetic();
    Evaluator<Integer> evaluator = new Evaluator<>();
    EvaluationRun first = evaluator.run(schema, 7);

    for (int i = 0; i < 50; i++) {
      EvaluationRun again = evaluator.run(schema, 7);
      assertEquals(first.record(), again.record());
      assertEquals(first.selectedClauses(), again.selectedClauses());
    }
    assertEquals(
        List.of("p", "q", "z", "r"),
        schema.evaluationOrder().stream().map(PropertyName::value).toList());
  }

  @Test
  void traceCanBeDisabled() {
    EvaluationRun run =
        new Evaluator<Integer>(EvaluationOptions.defaults().withRecordTrace(false))
            .run(ExampleSchemas.arithmetic(), 2);

    assertFalse(run.hasTrace());
    assertEquals(-1, run.selectedClause("q"));
  }

  @Test
  void concurrentEvaluationsShareOneSchema() throws InterruptedException {
    Schema<Integer> schema = ExampleSchemas.arithmetic();
    Evaluator<Integer> evaluator = new Evaluator<>();
    Map<Integer, ResultRecord> results = new ConcurrentHashMap<>();
    List<Thread> threads = new ArrayList<>();
    for (int t = 0; t < 8; t++) {
      int input = t;
      threads.add(new Thread(() -> results.put(input, evaluator.evaluate(schema, input))));
    }
    threads.forEach(Thread::start);
    for (Thread thread : threads) {
      thread.join();
    }

    assertEquals(8, results.size());
    for (Map.Entry<Integer, ResultRecord> entry : results.entrySet()) {
      assertEquals(evaluator.evaluate(schema, entry.getKey()), entry.getValue());
    }
    assertTrue(results.get(2).has("z"));
  }

  private static Object remember(
      Map<String, Set<PropertyName>> seen, String property, Set<PropertyName> bound) {
    seen.put(property, Set.copyOf(bound));
    return property;
  }
}
