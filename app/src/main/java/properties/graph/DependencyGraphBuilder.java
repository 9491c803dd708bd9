package properties.graph;

import java.util.List;
import java.util.Objects;
import properties.core.PropertyDeclaration;
import properties.core.PropertyName;

/**
 * Turns property declarations into a {@link DependencyGraph}.
 *
 * <p>Every declared name becomes a vertex, in first-declaration order. For each declaration
 * {@code p} and each {@code r} it requires, the edge {@code r -> p} is added. No validation happens
 * here: a self-requirement yields a self-loop and an undeclared requirement yields an extra vertex
 * after the declared ones.
 */
public final class DependencyGraphBuilder {

  public DependencyGraph build(List<? extends PropertyDeclaration<?>> declarations) {
    Objects.requireNonNull(declarations, "declarations");
    DependencyGraph.Builder graph = DependencyGraph.builder();
    for (PropertyDeclaration<?> declaration : declarations) {
      graph.addVertex(declaration.name());
    }
    for (PropertyDeclaration<?> declaration : declarations) {
      for (PropertyName required : declaration.requiredNames()) {
        graph.addEdge(required, declaration.name());
      }
    }
    return graph.build();
  }
}
