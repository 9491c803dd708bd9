package properties.schema.stages;

import java.util.Objects;
import properties.graph.DependencyGraph;
import properties.graph.DependencyGraphBuilder;
import properties.schema.SchemaBuildContext;
import properties.schema.SchemaStage;

/** Builds the dependency graph from the merged declarations. */
public final class GraphStage implements SchemaStage {
  private final DependencyGraphBuilder graphBuilder;

  public GraphStage() {
    this(new DependencyGraphBuilder());
  }

  public GraphStage(DependencyGraphBuilder graphBuilder) {
    this.graphBuilder = Objects.requireNonNull(graphBuilder, "graphBuilder");
  }

  @Override
  public <I> void execute(SchemaBuildContext<I> context) {
    Objects.requireNonNull(context, "context");
    DependencyGraph graph = graphBuilder.build(context.merged());
    context.setGraph(graph);
  }
}
