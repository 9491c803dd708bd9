package properties.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import properties.core.PropertyName;

/**
 * Finds every vertex that lies on a cycle.
 *
 * <p>Uses Tarjan's strongly connected components with an explicit stack. A vertex is on a cycle
 * when its component has more than one member or when it has a self-loop.
 */
public final class CycleDetector {

  /**
   * Returns the vertices that participate in some cycle, ordered by declaration index, or empty
   * when the graph is acyclic.
   */
  public Optional<Set<PropertyName>> findCycle(DependencyGraph graph) {
    Objects.requireNonNull(graph, "graph");
    int n = graph.vertexCount();
    List<PropertyName> vertices = graph.vertices();
    int[][] adjacency = adjacency(graph);

    int[] index = new int[n];
    int[] low = new int[n];
    boolean[] onStack = new boolean[n];
    Arrays.fill(index, -1);
    Deque<Integer> componentStack = new ArrayDeque<>();
    // frame = {vertex, next successor position}
    Deque<int[]> callStack = new ArrayDeque<>();
    Set<Integer> cyclic = new TreeSet<>();
    int counter = 0;

    for (int root = 0; root < n; root++) {
      if (index[root] != -1) {
        continue;
      }
      index[root] = low[root] = counter++;
      componentStack.push(root);
      onStack[root] = true;
      callStack.push(new int[] {root, 0});

      while (!callStack.isEmpty()) {
        int[] frame = callStack.peek();
        int v = frame[0];
        if (frame[1] < adjacency[v].length) {
          int w = adjacency[v][frame[1]++];
          if (index[w] == -1) {
            index[w] = low[w] = counter++;
            componentStack.push(w);
            onStack[w] = true;
            callStack.push(new int[] {w, 0});
          } else if (onStack[w]) {
            low[v] = Math.min(low[v], index[w]);
          }
          continue;
        }

        callStack.pop();
        if (low[v] == index[v]) {
          List<Integer> component = popComponent(componentStack, onStack, v);
          if (component.size() > 1 || hasSelfLoop(adjacency, v)) {
            cyclic.addAll(component);
          }
        }
        if (!callStack.isEmpty()) {
          int parent = callStack.peek()[0];
          low[parent] = Math.min(low[parent], low[v]);
        }
      }
    }

    if (cyclic.isEmpty()) {
      return Optional.empty();
    }
    Set<PropertyName> members = new LinkedHashSet<>();
    for (int i : cyclic) {
      members.add(vertices.get(i));
    }
    return Optional.of(Collections.unmodifiableSet(members));
  }

  public boolean isCyclic(DependencyGraph graph) {
    return findCycle(graph).isPresent();
  }

  private static List<Integer> popComponent(Deque<Integer> stack, boolean[] onStack, int root) {
    List<Integer> component = new ArrayList<>();
    int w;
    do {
      w = stack.pop();
      onStack[w] = false;
      component.add(w);
    } while (w != root);
    return component;
  }

  private static boolean hasSelfLoop(int[][] adjacency, int v) {
    for (int w : adjacency[v]) {
      if (w == v) {
        return true;
      }
    }
    return false;
  }

  private static int[][] adjacency(DependencyGraph graph) {
    List<PropertyName> vertices = graph.vertices();
    int[][] adjacency = new int[vertices.size()][];
    for (int i = 0; i < vertices.size(); i++) {
      adjacency[i] =
          graph.successors(vertices.get(i)).stream()
              .mapToInt(graph::declarationIndex)
              .toArray();
    }
    return adjacency;
  }
}
