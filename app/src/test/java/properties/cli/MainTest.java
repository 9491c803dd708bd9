package properties.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

final class MainTest {
  private final ByteArrayOutputStream out = new ByteArrayOutputStream();
  private final ByteArrayOutputStream err = new ByteArrayOutputStream();

  @Test
  void evaluatesCommaSeparatedInputs() {
    int code = run("2,3", "-3");

    assertEquals(Main.EXIT_OK, code, stderr());
    JsonObject report = JsonParser.parseString(stdout()).getAsJsonObject();
    JsonArray results = report.getAsJsonArray("results");
    assertEquals(3, results.size());
    JsonObject first = results.get(0).getAsJsonObject().getAsJsonObject("record");
    assertEquals(30, first.get("r").getAsInt());
    assertEquals(50, first.get("z").getAsInt());
    assertEquals("p", report.getAsJsonArray("evaluation_order").get(0).getAsString());
  }

  @Test
  void printsSchemaOnly() {
    int code = run("--schema", "--example", "text");

    assertEquals(Main.EXIT_OK, code, stderr());
    JsonObject schema =
        JsonParser.parseString(stdout()).getAsJsonObject().getAsJsonObject("schema");
    assertEquals("label", schema.getAsJsonArray("declaration_order").get(0).getAsString());
    assertEquals("words", schema.getAsJsonArray("evaluation_order").get(0).getAsString());
    assertTrue(schema.getAsJsonArray("edges").size() > 0);
  }

  @Test
  void parallelFlagProducesSameRecords() {
    run("1,2,3,4");
    String sequential = recordsOf(stdout());
    out.reset();

    run("--parallel", "1,2,3,4");

    assertEquals(sequential, recordsOf(stdout()));
  }

  @Test
  void badArgumentsReturnUsageCode() {
    assertEquals(Main.EXIT_USAGE, run("two"));
    assertTrue(stderr().contains("usage:"), stderr());
    assertEquals(Main.EXIT_USAGE, run("--unknown", "1"));
    assertEquals(Main.EXIT_USAGE, run());
    assertEquals(Main.EXIT_USAGE, run("--example", "nope", "1"));
  }

  private int run(String... args) {
    return new Main()
        .run(
            args,
            new PrintStream(out, true, StandardCharsets.UTF_8),
            new PrintStream(err, true, StandardCharsets.UTF_8));
  }

  private String stdout() {
    return out.toString(StandardCharsets.UTF_8);
  }

  private String stderr() {
    return err.toString(StandardCharsets.UTF_8);
  }

  private static String recordsOf(String json) {
    JsonArray results = JsonParser.parseString(json).getAsJsonObject().getAsJsonArray("results");
    StringBuilder records = new StringBuilder();
    results.forEach(r -> records.append(r.getAsJsonObject().get("record")).append('\n'));
    return records.toString();
  }
}
