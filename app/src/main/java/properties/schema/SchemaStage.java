package properties.schema;

/** One step of schema construction, run in sequence by {@link SchemaBuilder}. */
public interface SchemaStage {
  <I> void execute(SchemaBuildContext<I> context);
}
