package properties.cli;

import java.util.List;
import java.util.Objects;

record CliOptions(String example, boolean schemaOnly, boolean parallel, List<String> inputs) {
  static final String DEFAULT_EXAMPLE = "arithmetic";

  CliOptions {
    example = example == null || example.isBlank() ? DEFAULT_EXAMPLE : example;
    inputs = List.copyOf(Objects.requireNonNull(inputs, "inputs"));
    if (!schemaOnly && inputs.isEmpty()) {
      throw new IllegalArgumentException("at least one input is required");
    }
  }
}
