package properties.cli;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import properties.core.PropertyDeclaration;
import properties.core.PropertyName;
import properties.eval.EvaluationRun;
import properties.graph.DependencyEdge;
import properties.schema.Schema;

/** Renders schemas and evaluation runs as pretty-printed JSON. */
final class JsonReportBuilder {
  private static final String VERSION = "1.0.0";
  private final Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

  String schema(String name, Schema<?> schema) {
    Map<String, Object> root = new LinkedHashMap<>();
    root.put("meta", meta(name, schema));
    root.put("schema", schemaSummary(schema));
    return gson.toJson(root);
  }

  <I> String evaluation(String name, Schema<I> schema, List<I> inputs, List<EvaluationRun> runs) {
    if (inputs.size() != runs.size()) {
      throw new IllegalArgumentException("one run per input expected");
    }
    Map<String, Object> root = new LinkedHashMap<>();
    root.put("meta", meta(name, schema));
    root.put("evaluation_order", names(schema.evaluationOrder()));
    List<Map<String, Object>> results = new ArrayList<>();
    for (int i = 0; i < runs.size(); i++) {
      EvaluationRun run = runs.get(i);
      Map<String, Object> entry = new LinkedHashMap<>();
      entry.put("input", inputs.get(i));
      entry.put("record", run.record().toStringKeyedMap());
      if (run.hasTrace()) {
        Map<String, Integer> clauses = new LinkedHashMap<>();
        run.selectedClauses().forEach((property, index) -> clauses.put(property.value(), index));
        entry.put("selected_clauses", clauses);
      }
      entry.put("time_us", run.elapsedMicros());
      results.add(entry);
    }
    root.put("results", results);
    return gson.toJson(root);
  }

  private Map<String, Object> meta(String name, Schema<?> schema) {
    Map<String, Object> meta = new LinkedHashMap<>();
    meta.put("version", VERSION);
    meta.put("schema", name);
    meta.put("property_count", schema.size());
    meta.put("edge_count", schema.graph().edgeCount());
    return meta;
  }

  private Map<String, Object> schemaSummary(Schema<?> schema) {
    Map<String, Object> summary = new LinkedHashMap<>();
    summary.put("declaration_order", names(schema.names()));
    summary.put("evaluation_order", names(schema.evaluationOrder()));
    List<String> edges = new ArrayList<>();
    for (DependencyEdge edge : schema.graph().edges()) {
      edges.add(edge.toString());
    }
    summary.put("edges", edges);
    List<Map<String, Object>> properties = new ArrayList<>();
    for (PropertyDeclaration<?> declaration : schema.declarations().values()) {
      Map<String, Object> entry = new LinkedHashMap<>();
      entry.put("name", declaration.name().value());
      entry.put("type", declaration.valueType().getSimpleName());
      entry.put("clauses", declaration.clauses().size());
      entry.put("requires", names(declaration.requiredNames()));
      properties.add(entry);
    }
    summary.put("properties", properties);
    return summary;
  }

  private static List<String> names(Iterable<PropertyName> names) {
    List<String> out = new ArrayList<>();
    names.forEach(name -> out.add(name.value()));
    return out;
  }
}
