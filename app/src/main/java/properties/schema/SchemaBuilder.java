package properties.schema;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import properties.core.PropertyDeclaration;
import properties.schema.stages.CycleDetectionStage;
import properties.schema.stages.DeclarationMergeStage;
import properties.schema.stages.GraphStage;
import properties.schema.stages.OrderingStage;
import properties.schema.stages.ReferenceValidationStage;

/**
 * Collects property declarations and turns them into a {@link Schema}.
 *
 * <p>Callers add one or more declarations per property and call {@link #build()} once. The build
 * runs a linear list of {@link SchemaStage}s over a shared {@link SchemaBuildContext}: merge,
 * reference validation, graph construction, cycle detection, ordering. Any stage may throw; in
 * that case no schema is produced.
 */
public final class SchemaBuilder<I> {
  private static final Logger LOG = LoggerFactory.getLogger(SchemaBuilder.class);

  private final List<SchemaStage> stages;
  private final List<PropertyDeclaration<I>> declarations = new ArrayList<>();

  public SchemaBuilder() {
    this(defaultStages());
  }

  public SchemaBuilder(List<SchemaStage> stages) {
    if (stages == null || stages.isEmpty()) {
      throw new IllegalArgumentException("stages must not be empty");
    }
    this.stages = List.copyOf(stages);
  }

  public static List<SchemaStage> defaultStages() {
    return List.of(
        new DeclarationMergeStage(),
        new ReferenceValidationStage(),
        new GraphStage(),
        new CycleDetectionStage(),
        new OrderingStage());
  }

  /** Builds a schema from a complete declaration list in one call. */
  public static <I> Schema<I> buildSchema(List<PropertyDeclaration<I>> declarations) {
    return new SchemaBuilder<I>().addAll(declarations).build();
  }

  public List<SchemaStage> stages() {
    return stages;
  }

  public SchemaBuilder<I> add(PropertyDeclaration<I> declaration) {
    declarations.add(Objects.requireNonNull(declaration, "declaration"));
    return this;
  }

  public SchemaBuilder<I> addAll(List<PropertyDeclaration<I>> declarations) {
    Objects.requireNonNull(declarations, "declarations").forEach(this::add);
    return this;
  }

  /** Declares property {@code name}, configured through its declaration builder. */
  public SchemaBuilder<I> property(String name, Consumer<PropertyDeclaration.Builder<I>> spec) {
    Objects.requireNonNull(spec, "spec");
    PropertyDeclaration.Builder<I> builder = PropertyDeclaration.builder(name);
    spec.accept(builder);
    return add(builder.build());
  }

  /**
   * Validates and orders the collected declarations.
   *
   * @throws properties.core.error.CyclicDependencyException if dependencies form a cycle
   * @throws properties.core.error.UndeclaredPropertyException if a requirement names no property
   */
  public Schema<I> build() {
    SchemaBuildContext<I> context = new SchemaBuildContext<>(declarations);
    for (SchemaStage stage : stages) {
      stage.execute(context);
    }
    if (!context.isOrdered()) {
      throw new IllegalStateException("stage list did not produce an evaluation order");
    }
    Schema<I> schema = Schema.fromContext(context);
    LOG.info(
        "Built schema with {} properties and {} edges in {} us",
        schema.size(),
        schema.graph().edgeCount(),
        context.timing().elapsedMicros());
    LOG.debug("Evaluation order: {}", schema.evaluationOrder());
    return schema;
  }
}
