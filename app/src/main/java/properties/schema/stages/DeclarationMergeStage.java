package properties.schema.stages;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import properties.core.PropertyDeclaration;
import properties.core.PropertyName;
import properties.schema.SchemaBuildContext;
import properties.schema.SchemaStage;

/**
 * Collapses declarations that share a name into one, appending clauses in declaration order. The
 * merged property keeps the position of its first declaration.
 */
public final class DeclarationMergeStage implements SchemaStage {

  @Override
  public <I> void execute(SchemaBuildContext<I> context) {
    Objects.requireNonNull(context, "context");
    Map<PropertyName, PropertyDeclaration<I>> byName = new LinkedHashMap<>();
    for (PropertyDeclaration<I> declaration : context.declarations()) {
      byName.merge(declaration.name(), declaration, (first, next) -> first.mergedWith(next));
    }
    for (PropertyDeclaration<I> declaration : byName.values()) {
      if (declaration.clauses().isEmpty()) {
        throw new IllegalArgumentException("property " + declaration.name() + " has no clauses");
      }
    }
    context.setMerged(new ArrayList<>(byName.values()));
  }
}
