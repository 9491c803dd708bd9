package properties.schema.stages;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import properties.core.PropertyName;
import properties.core.error.CyclicDependencyException;
import properties.graph.CycleDetector;
import properties.schema.SchemaBuildContext;
import properties.schema.SchemaStage;

/** Fails the build with the full set of cycle members if the graph is not acyclic. */
public final class CycleDetectionStage implements SchemaStage {
  private static final Logger LOG = LoggerFactory.getLogger(CycleDetectionStage.class);

  private final CycleDetector detector;

  public CycleDetectionStage() {
    this(new CycleDetector());
  }

  public CycleDetectionStage(CycleDetector detector) {
    this.detector = Objects.requireNonNull(detector, "detector");
  }

  @Override
  public <I> void execute(SchemaBuildContext<I> context) {
    Objects.requireNonNull(context, "context");
    Optional<Set<PropertyName>> cycle = detector.findCycle(context.graph());
    if (cycle.isPresent()) {
      LOG.warn("Dependency cycle among {}", cycle.get());
      throw new CyclicDependencyException(cycle.get());
    }
  }
}
