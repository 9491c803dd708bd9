package properties.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import properties.core.PropertyName;

/**
 * Immutable directed graph of "must precede" edges between properties.
 *
 * <p>Vertices keep the order in which they were first declared; that position is the declaration
 * index used to break ties when ordering. Edges form a set, so adding the same edge twice has no
 * effect.
 */
public final class DependencyGraph {
  private final List<PropertyName> vertices;
  private final Map<PropertyName, Integer> indexByVertex;
  private final Map<PropertyName, Set<PropertyName>> successors;
  private final Map<PropertyName, Set<PropertyName>> predecessors;
  private final int edgeCount;

  private DependencyGraph(
      List<PropertyName> vertices,
      Map<PropertyName, Set<PropertyName>> successors,
      Map<PropertyName, Set<PropertyName>> predecessors) {
    this.vertices = List.copyOf(vertices);
    Map<PropertyName, Integer> index = new LinkedHashMap<>();
    for (int i = 0; i < this.vertices.size(); i++) {
      index.put(this.vertices.get(i), i);
    }
    this.indexByVertex = Collections.unmodifiableMap(index);
    this.successors = freeze(successors, this.vertices);
    this.predecessors = freeze(predecessors, this.vertices);
    this.edgeCount = this.successors.values().stream().mapToInt(Set::size).sum();
  }

  public static Builder builder() {
    return new Builder();
  }

  public List<PropertyName> vertices() {
    return vertices;
  }

  public int vertexCount() {
    return vertices.size();
  }

  public int edgeCount() {
    return edgeCount;
  }

  public boolean contains(PropertyName vertex) {
    return indexByVertex.containsKey(vertex);
  }

  /** Position of {@code vertex} in declaration order. */
  public int declarationIndex(PropertyName vertex) {
    Integer index = indexByVertex.get(vertex);
    if (index == null) {
      throw new IllegalArgumentException("unknown vertex " + vertex);
    }
    return index;
  }

  /** Vertices that must be computed after {@code vertex}. */
  public Set<PropertyName> successors(PropertyName vertex) {
    return successors.getOrDefault(vertex, Set.of());
  }

  /** Vertices that must be computed before {@code vertex}. */
  public Set<PropertyName> predecessors(PropertyName vertex) {
    return predecessors.getOrDefault(vertex, Set.of());
  }

  public boolean hasEdge(PropertyName from, PropertyName to) {
    return successors(from).contains(to);
  }

  /** All edges, grouped by source in declaration order. */
  public List<DependencyEdge> edges() {
    List<DependencyEdge> edges = new ArrayList<>(edgeCount);
    for (PropertyName from : vertices) {
      for (PropertyName to : successors(from)) {
        edges.add(new DependencyEdge(from, to));
      }
    }
    return edges;
  }

  private static Map<PropertyName, Set<PropertyName>> freeze(
      Map<PropertyName, Set<PropertyName>> adjacency, List<PropertyName> vertices) {
    Map<PropertyName, Set<PropertyName>> frozen = new LinkedHashMap<>();
    for (PropertyName vertex : vertices) {
      Set<PropertyName> neighbours = adjacency.getOrDefault(vertex, Set.of());
      frozen.put(vertex, Collections.unmodifiableSet(new LinkedHashSet<>(neighbours)));
    }
    return Collections.unmodifiableMap(frozen);
  }

  @Override
  public String toString() {
    return "DependencyGraph" + edges();
  }

  /** Mutable accumulator; vertices are numbered in the order they are first added. */
  public static final class Builder {
    private final Set<PropertyName> vertices = new LinkedHashSet<>();
    private final Map<PropertyName, Set<PropertyName>> successors = new LinkedHashMap<>();
    private final Map<PropertyName, Set<PropertyName>> predecessors = new LinkedHashMap<>();

    private Builder() {}

    public Builder addVertex(PropertyName vertex) {
      vertices.add(Objects.requireNonNull(vertex, "vertex"));
      return this;
    }

    /** Adds {@code from -> to}, creating either endpoint if it is new. */
    public Builder addEdge(PropertyName from, PropertyName to) {
      addVertex(from);
      addVertex(to);
      successors.computeIfAbsent(from, k -> new LinkedHashSet<>()).add(to);
      predecessors.computeIfAbsent(to, k -> new LinkedHashSet<>()).add(from);
      return this;
    }

    public DependencyGraph build() {
      return new DependencyGraph(new ArrayList<>(vertices), successors, predecessors);
    }
  }
}
