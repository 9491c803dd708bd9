package properties.examples;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import properties.core.Clause;
import properties.schema.Schema;

/** Built-in schemas used by the CLI and as fixtures. */
public final class ExampleSchemas {
  private ExampleSchemas() {}

  /**
   * Integer schema with four properties.
   *
   * <pre>
   * p = i + 1
   * q = i * 5      when p > 0
   *   = i * 5      when p == 3
   *   = p * i      otherwise
   * r = p * q      (also waits for z)
   * z = q * 5
   * </pre>
   *
   * For input 2 the record is {@code {p=3, q=10, r=30, z=50}}.
   */
  public static Schema<Integer> arithmetic() {
    return Schema.<Integer>builder()
        .property("p", p -> p.type(Integer.class).always((i, partial) -> i + 1))
        .property(
            "q",
            q ->
                q.type(Integer.class)
                    .clause(
                        Clause.<Integer>builder()
                            .whenBound("p")
                            .guard((i, partial) -> partial.get("p", Integer.class) > 0)
                            .body((i, partial) -> i * 5))
                    .clause(Clause.<Integer>builder().whenEqual("p", 3).body((i, partial) -> i * 5))
                    .clause(
                        Clause.<Integer>builder()
                            .whenBound("p")
                            .body((i, partial) -> partial.get("p", Integer.class) * i)))
        .property(
            "r",
            r ->
                r.type(Integer.class)
                    .clause(
                        Clause.<Integer>builder()
                            .requires("p", "q", "z")
                            .body(
                                (i, partial) ->
                                    partial.get("p", Integer.class)
                                        * partial.get("q", Integer.class))))
        .property(
            "z",
            z ->
                z.type(Integer.class)
                    .clause(
                        Clause.<Integer>builder()
                            .whenBound("q")
                            .body((i, partial) -> partial.get("q", Integer.class) * 5)))
        .build();
  }

  /**
   * Text statistics over a string input: word list, counts, average word length and a size label
   * chosen by guarded clauses.
   */
  public static Schema<String> text() {
    return Schema.<String>builder()
        .property(
            "label",
            label ->
                label
                    .type(String.class)
                    .clause(
                        Clause.<String>builder()
                            .whenEqual("wordCount", 0)
                            .body((s, partial) -> "empty"))
                    .clause(
                        Clause.<String>builder()
                            .requires("wordCount")
                            .guard((s, partial) -> partial.get("wordCount", Integer.class) < 5)
                            .body((s, partial) -> "short"))
                    .clause(
                        Clause.<String>builder()
                            .requires("averageWordLength")
                            .guard(
                                (s, partial) ->
                                    partial.get("averageWordLength", Double.class) >= 7.0)
                            .body((s, partial) -> "dense"))
                    .always((s, partial) -> "long"))
        .property("words", words -> words.type(List.class).always((s, partial) -> tokenize(s)))
        .property(
            "wordCount",
            count ->
                count
                    .type(Integer.class)
                    .clause(
                        Clause.<String>builder()
                            .whenBound("words")
                            .body((s, partial) -> partial.get("words", List.class).size())))
        .property(
            "averageWordLength",
            average ->
                average
                    .type(Double.class)
                    .clause(
                        Clause.<String>builder()
                            .whenEqual("wordCount", 0)
                            .body((s, partial) -> 0.0))
                    .clause(
                        Clause.<String>builder()
                            .requires("words", "wordCount")
                            .body(
                                (s, partial) -> {
                                  List<?> words = partial.get("words", List.class);
                                  int letters =
                                      words.stream().mapToInt(w -> ((String) w).length()).sum();
                                  return (double) letters / partial.get("wordCount", Integer.class);
                                })))
        .build();
  }

  private static List<String> tokenize(String s) {
    if (s == null || s.isBlank()) {
      return List.of();
    }
    return Arrays.stream(s.trim().toLowerCase(Locale.ROOT).split("\\s+")).toList();
  }
}
