package properties.cli;

import com.google.common.base.Splitter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/** Argument parsing for {@link Main}. */
final class CliParsers {
  private static final Splitter COMMA = Splitter.on(',').trimResults().omitEmptyStrings();

  private CliParsers() {}

  static CliOptions parse(String[] args) {
    String example = null;
    boolean schemaOnly = false;
    boolean parallel = false;
    List<String> inputs = new ArrayList<>();
    String[] effective = args == null ? new String[0] : args;

    for (int i = 0; i < effective.length; i++) {
      String arg = effective[i];
      switch (arg) {
        case "--schema" -> schemaOnly = true;
        case "--parallel" -> parallel = true;
        case "--example" -> {
          if (i + 1 >= effective.length) {
            throw new IllegalArgumentException("Missing value for --example");
          }
          example = effective[++i].toLowerCase(Locale.ROOT);
        }
        default -> {
          if (arg.startsWith("--")) {
            throw new IllegalArgumentException("Unknown option: " + arg);
          }
          inputs.add(arg);
        }
      }
    }
    return new CliOptions(example, schemaOnly, parallel, inputs);
  }

  /** Integer inputs; each argument may hold a comma-separated list. */
  static List<Integer> parseIntegers(List<String> raw) {
    List<Integer> values = new ArrayList<>();
    for (String arg : raw) {
      for (String part : COMMA.split(arg)) {
        try {
          values.add(Integer.parseInt(part));
        } catch (NumberFormatException ex) {
          throw new IllegalArgumentException("Invalid integer input: " + part, ex);
        }
      }
    }
    if (values.isEmpty()) {
      throw new IllegalArgumentException("at least one input is required");
    }
    return values;
  }
}
