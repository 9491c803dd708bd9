package properties.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import properties.core.PropertyDeclaration;
import properties.core.PropertyName;
import properties.core.ResultRecord;
import properties.eval.Evaluator;
import properties.graph.DependencyGraph;

/**
 * Validated set of property declarations plus their evaluation order.
 *
 * <p>Only {@link SchemaBuilder} creates instances, and only for acyclic declaration sets. A schema
 * never changes after construction and may be shared by any number of concurrent evaluations.
 *
 * @param <I> type of the input every property is derived from
 */
public final class Schema<I> {
  private final Map<PropertyName, PropertyDeclaration<I>> declarations;
  private final List<PropertyName> names;
  private final List<PropertyName> evaluationOrder;
  private final DependencyGraph graph;

  private Schema(
      List<PropertyDeclaration<I>> declarations,
      List<PropertyName> evaluationOrder,
      DependencyGraph graph) {
    Map<PropertyName, PropertyDeclaration<I>> byName = new LinkedHashMap<>();
    for (PropertyDeclaration<I> declaration : declarations) {
      byName.put(declaration.name(), declaration);
    }
    this.declarations = Collections.unmodifiableMap(byName);
    this.names = List.copyOf(byName.keySet());
    this.evaluationOrder = List.copyOf(evaluationOrder);
    this.graph = Objects.requireNonNull(graph, "graph");
    if (!Set.copyOf(this.evaluationOrder).equals(byName.keySet())
        || this.evaluationOrder.size() != this.names.size()) {
      throw new IllegalStateException("evaluation order must list every property exactly once");
    }
  }

  /** Assembles the schema from a context that went through every stage. */
  static <I> Schema<I> fromContext(SchemaBuildContext<I> context) {
    Objects.requireNonNull(context, "context");
    return new Schema<>(context.merged(), context.evaluationOrder(), context.graph());
  }

  public static <I> SchemaBuilder<I> builder() {
    return new SchemaBuilder<>();
  }

  /** Declared names in declaration order; this is also the field order of results. */
  public List<PropertyName> names() {
    return names;
  }

  public List<PropertyName> evaluationOrder() {
    return evaluationOrder;
  }

  public int size() {
    return names.size();
  }

  public DependencyGraph graph() {
    return graph;
  }

  public Map<PropertyName, PropertyDeclaration<I>> declarations() {
    return declarations;
  }

  public PropertyDeclaration<I> declaration(PropertyName name) {
    PropertyDeclaration<I> declaration = declarations.get(name);
    if (declaration == null) {
      throw new IllegalArgumentException("unknown property " + name);
    }
    return declaration;
  }

  public PropertyDeclaration<I> declaration(String name) {
    return declaration(PropertyName.key(name));
  }

  public int declarationIndex(PropertyName name) {
    return graph.declarationIndex(name);
  }

  /** Properties that must be computed before {@code name}. */
  public Set<PropertyName> dependenciesOf(PropertyName name) {
    declaration(name);
    return graph.predecessors(name);
  }

  /** Properties whose computation waits for {@code name}. */
  public Set<PropertyName> dependentsOf(PropertyName name) {
    declaration(name);
    return graph.successors(name);
  }

  /** Evaluates every property for {@code input} with default options. */
  public ResultRecord evaluate(I input) {
    return new Evaluator<I>().evaluate(this, input);
  }

  @Override
  public String toString() {
    return "Schema" + evaluationOrder;
  }
}
