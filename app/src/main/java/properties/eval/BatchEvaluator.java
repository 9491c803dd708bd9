package properties.eval;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ForkJoinPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import properties.core.ResultRecord;
import properties.schema.Schema;
import properties.util.Timing;

/**
 * Evaluates many inputs against one shared {@link Schema}.
 *
 * <p>Evaluations share nothing but the schema, so the parallel mode runs them on a {@link
 * ForkJoinPool} without coordination. Results come back in input order; the first failure
 * propagates and no results are returned.
 */
public final class BatchEvaluator<I> {
  private static final Logger LOG = LoggerFactory.getLogger(BatchEvaluator.class);

  /**
   * Execution mode for a batch.
   *
   * @param inParallel whether inputs are evaluated on a fork-join pool
   * @param parallelism pool size, at least 1
   */
  public record Config(boolean inParallel, int parallelism) {
    public Config {
      if (parallelism < 1) {
        throw new IllegalArgumentException("parallelism must be at least 1");
      }
    }

    public static Config sequential() {
      return new Config(false, Runtime.getRuntime().availableProcessors());
    }

    public static Config parallel() {
      return new Config(true, Runtime.getRuntime().availableProcessors());
    }

    public static Config parallel(int parallelism) {
      return new Config(true, parallelism);
    }
  }

  private final Evaluator<I> evaluator;
  private final Config config;

  public BatchEvaluator(Evaluator<I> evaluator, Config config) {
    this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
    this.config = Objects.requireNonNull(config, "config");
  }

  public BatchEvaluator(Config config) {
    this(new Evaluator<>(), config);
  }

  public List<ResultRecord> evaluateAll(Schema<I> schema, List<I> inputs) {
    return runAll(schema, inputs).stream().map(EvaluationRun::record).toList();
  }

  /** Evaluates every input, keeping the per-run trace and timing. */
  public List<EvaluationRun> runAll(Schema<I> schema, List<I> inputs) {
    Objects.requireNonNull(schema, "schema");
    Objects.requireNonNull(inputs, "inputs");
    Timing timing = Timing.start();
    List<EvaluationRun> runs =
        config.inParallel() ? runParallel(schema, inputs) : runSequential(schema, inputs);
    LOG.info(
        "Evaluated {} inputs ({}) in {} ms",
        inputs.size(),
        config.inParallel() ? "parallel x" + config.parallelism() : "sequential",
        timing.elapsedMillis());
    return runs;
  }

  private List<EvaluationRun> runSequential(Schema<I> schema, List<I> inputs) {
    List<EvaluationRun> runs = new ArrayList<>(inputs.size());
    for (I input : inputs) {
      runs.add(evaluator.run(schema, input));
    }
    return List.copyOf(runs);
  }

  private List<EvaluationRun> runParallel(Schema<I> schema, List<I> inputs) {
    ForkJoinPool pool =
        config.parallelism() == ForkJoinPool.getCommonPoolParallelism()
            ? ForkJoinPool.commonPool()
            : new ForkJoinPool(config.parallelism());
    try {
      return pool.submit(
              () -> inputs.parallelStream().map(input -> evaluator.run(schema, input)).toList())
          .join();
    } finally {
      if (pool != ForkJoinPool.commonPool()) {
        pool.shutdown();
      }
    }
  }
}
