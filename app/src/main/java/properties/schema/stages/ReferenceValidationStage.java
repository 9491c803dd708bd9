package properties.schema.stages;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import properties.core.PropertyDeclaration;
import properties.core.PropertyName;
import properties.core.error.UndeclaredPropertyException;
import properties.schema.SchemaBuildContext;
import properties.schema.SchemaStage;

/** Rejects requirements on names that no declaration provides. */
public final class ReferenceValidationStage implements SchemaStage {
  private static final Logger LOG = LoggerFactory.getLogger(ReferenceValidationStage.class);

  @Override
  public <I> void execute(SchemaBuildContext<I> context) {
    Objects.requireNonNull(context, "context");
    Set<PropertyName> declared =
        context.merged().stream()
            .map(PropertyDeclaration::name)
            .collect(Collectors.toCollection(LinkedHashSet::new));

    Map<PropertyName, Set<PropertyName>> missing = new LinkedHashMap<>();
    for (PropertyDeclaration<I> declaration : context.merged()) {
      for (PropertyName required : declaration.requiredNames()) {
        if (!declared.contains(required)) {
          missing.computeIfAbsent(declaration.name(), k -> new LinkedHashSet<>()).add(required);
        }
      }
    }
    if (!missing.isEmpty()) {
      LOG.warn("Schema references undeclared properties: {}", missing);
      throw new UndeclaredPropertyException(missing);
    }
  }
}
