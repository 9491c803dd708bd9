package properties.graph;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.PriorityQueue;
import properties.core.PropertyName;

/**
 * Orders the vertices of an acyclic {@link DependencyGraph} so every edge points forward.
 *
 * <p>Kahn's algorithm: repeatedly emit a vertex whose predecessors have all been emitted, picking
 * the smallest declaration index among the eligible ones. The result is therefore unique for a
 * given graph and declaration order.
 */
public final class TopologicalSorter {

  public List<PropertyName> sort(DependencyGraph graph) {
    Objects.requireNonNull(graph, "graph");
    return sort(graph, graph.vertices());
  }

  /**
   * @param declarationOrder every vertex of {@code graph} exactly once; position is the tie-break
   * @throws IllegalStateException if the graph has a cycle
   */
  public List<PropertyName> sort(DependencyGraph graph, List<PropertyName> declarationOrder) {
    Objects.requireNonNull(graph, "graph");
    Objects.requireNonNull(declarationOrder, "declarationOrder");
    if (declarationOrder.size() != graph.vertexCount()
        || !declarationOrder.stream().allMatch(graph::contains)) {
      throw new IllegalArgumentException("declarationOrder must list every vertex exactly once");
    }

    Map<PropertyName, Integer> rank = new HashMap<>();
    for (int i = 0; i < declarationOrder.size(); i++) {
      if (rank.put(declarationOrder.get(i), i) != null) {
        throw new IllegalArgumentException("duplicate vertex " + declarationOrder.get(i));
      }
    }

    Map<PropertyName, Integer> pending = new HashMap<>();
    PriorityQueue<PropertyName> ready =
        new PriorityQueue<>((a, b) -> Integer.compare(rank.get(a), rank.get(b)));
    for (PropertyName vertex : declarationOrder) {
      int inDegree = graph.predecessors(vertex).size();
      pending.put(vertex, inDegree);
      if (inDegree == 0) {
        ready.add(vertex);
      }
    }

    List<PropertyName> order = new ArrayList<>(declarationOrder.size());
    while (!ready.isEmpty()) {
      PropertyName next = ready.poll();
      order.add(next);
      for (PropertyName successor : graph.successors(next)) {
        int remaining = pending.merge(successor, -1, Integer::sum);
        if (remaining == 0) {
          ready.add(successor);
        }
      }
    }

    if (order.size() != declarationOrder.size()) {
      throw new IllegalStateException("graph contains a cycle; run CycleDetector before sorting");
    }
    return List.copyOf(order);
  }
}
