package properties.util;

import java.util.concurrent.TimeUnit;

/** Monotonic stopwatch for schema builds and evaluation runs. */
public final class Timing {
  private final long startedAt;

  private Timing(long startedAt) {
    this.startedAt = startedAt;
  }

  public static Timing start() {
    return new Timing(System.nanoTime());
  }

  public long elapsedNanos() {
    return System.nanoTime() - startedAt;
  }

  public long elapsedMicros() {
    return TimeUnit.NANOSECONDS.toMicros(elapsedNanos());
  }

  public long elapsedMillis() {
    return TimeUnit.NANOSECONDS.toMillis(elapsedNanos());
  }
}
