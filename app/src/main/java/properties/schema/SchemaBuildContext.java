package properties.schema;

import java.util.List;
import java.util.Objects;
import properties.core.PropertyDeclaration;
import properties.core.PropertyName;
import properties.graph.DependencyGraph;
import properties.util.Timing;

/**
 * Mutable state passed through the {@link SchemaStage}s of one schema build. Holds the raw
 * declarations and the intermediates each stage produces.
 */
public final class SchemaBuildContext<I> {
  private final List<PropertyDeclaration<I>> declarations;
  private final Timing timing;

  private List<PropertyDeclaration<I>> merged;
  private DependencyGraph graph;
  private List<PropertyName> evaluationOrder;

  public SchemaBuildContext(List<PropertyDeclaration<I>> declarations) {
    this.declarations = List.copyOf(Objects.requireNonNull(declarations, "declarations"));
    this.timing = Timing.start();
  }

  public List<PropertyDeclaration<I>> declarations() {
    return declarations;
  }

  public Timing timing() {
    return timing;
  }

  /** One declaration per distinct name, in first-declaration order. */
  public List<PropertyDeclaration<I>> merged() {
    return requireStage(merged, "declaration merge");
  }

  public DependencyGraph graph() {
    return requireStage(graph, "graph construction");
  }

  public List<PropertyName> evaluationOrder() {
    return requireStage(evaluationOrder, "ordering");
  }

  public boolean isOrdered() {
    return evaluationOrder != null;
  }

  public void setMerged(List<PropertyDeclaration<I>> merged) {
    this.merged = List.copyOf(Objects.requireNonNull(merged, "merged"));
  }

  public void setGraph(DependencyGraph graph) {
    this.graph = Objects.requireNonNull(graph, "graph");
  }

  public void setEvaluationOrder(List<PropertyName> evaluationOrder) {
    this.evaluationOrder = List.copyOf(Objects.requireNonNull(evaluationOrder, "evaluationOrder"));
  }

  private static <T> T requireStage(T value, String stage) {
    if (value == null) {
      throw new IllegalStateException(stage + " must run first");
    }
    return value;
  }
}
