package properties.schema.stages;

import java.util.List;
import java.util.Objects;
import properties.core.PropertyDeclaration;
import properties.core.PropertyName;
import properties.graph.TopologicalSorter;
import properties.schema.SchemaBuildContext;
import properties.schema.SchemaStage;

/** Computes the evaluation order, breaking ties by declaration position. */
public final class OrderingStage implements SchemaStage {
  private final TopologicalSorter sorter;

  public OrderingStage() {
    this(new TopologicalSorter());
  }

  public OrderingStage(TopologicalSorter sorter) {
    this.sorter = Objects.requireNonNull(sorter, "sorter");
  }

  @Override
  public <I> void execute(SchemaBuildContext<I> context) {
    Objects.requireNonNull(context, "context");
    List<PropertyName> declarationOrder =
        context.merged().stream().map(PropertyDeclaration::name).toList();
    context.setEvaluationOrder(sorter.sort(context.graph(), declarationOrder));
  }
}
