package properties.cli;

import java.io.PrintStream;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import properties.core.error.PropertyEngineException;
import properties.eval.BatchEvaluator;
import properties.eval.EvaluationOptions;
import properties.eval.EvaluationRun;
import properties.eval.Evaluator;
import properties.examples.ExampleSchemas;
import properties.schema.Schema;

/**
 * Command-line entry point: evaluates a built-in schema and prints a JSON report.
 *
 * <p>Usage:
 *
 * <ul>
 *   <li>{@code Main 2,3,4} evaluates the arithmetic schema for three inputs
 *   <li>{@code Main --example text "a few words"} evaluates the text schema
 *   <li>{@code Main --schema [--example NAME]} prints the schema only
 *   <li>{@code --parallel} evaluates the inputs on a fork-join pool
 * </ul>
 */
public final class Main {
  private static final Logger LOG = LoggerFactory.getLogger(Main.class);

  static final int EXIT_OK = 0;
  static final int EXIT_FAILURE = 1;
  static final int EXIT_USAGE = 2;

  private static final String USAGE =
      "usage: Main [--example arithmetic|text] [--schema] [--parallel] INPUT...";

  private final JsonReportBuilder reports = new JsonReportBuilder();

  public static void main(String[] args) {
    int code = new Main().run(args, System.out, System.err);
    if (code != EXIT_OK) {
      System.exit(code);
    }
  }

  int run(String[] args, PrintStream out, PrintStream err) {
    try {
      CliOptions options = CliParsers.parse(args);
      return switch (options.example()) {
        case "arithmetic" ->
            execute(
                options,
                ExampleSchemas.arithmetic(),
                options.schemaOnly() ? List.of() : CliParsers.parseIntegers(options.inputs()),
                out);
        case "text" -> execute(options, ExampleSchemas.text(), options.inputs(), out);
        default -> throw new IllegalArgumentException("Unknown example: " + options.example());
      };
    } catch (PropertyEngineException ex) {
      LOG.error("Evaluation failed: {}", ex.getMessage(), ex);
      err.println("error: " + ex.getMessage());
      return EXIT_FAILURE;
    } catch (IllegalArgumentException ex) {
      err.println(ex.getMessage());
      err.println(USAGE);
      return EXIT_USAGE;
    }
  }

  private <I> int execute(CliOptions options, Schema<I> schema, List<I> inputs, PrintStream out) {
    if (options.schemaOnly()) {
      out.println(reports.schema(options.example(), schema));
      return EXIT_OK;
    }
    BatchEvaluator.Config config =
        options.parallel() ? BatchEvaluator.Config.parallel() : BatchEvaluator.Config.sequential();
    BatchEvaluator<I> batch =
        new BatchEvaluator<>(new Evaluator<>(EvaluationOptions.fromSystemProperties()), config);
    List<EvaluationRun> runs = batch.runAll(schema, inputs);
    out.println(reports.evaluation(options.example(), schema, inputs, runs));
    return EXIT_OK;
  }
}
