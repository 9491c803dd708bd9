package properties.eval;

/**
 * Configuration for {@link Evaluator}.
 *
 * @param verifyValueTypes reject body results that are not instances of the declared value type
 * @param recordTrace keep the selected clause index per property in the {@link EvaluationRun}
 */
public record EvaluationOptions(boolean verifyValueTypes, boolean recordTrace) {
  public static final String VERIFY_VALUE_TYPES_PROPERTY = "properties.verifyValueTypes";
  public static final String RECORD_TRACE_PROPERTY = "properties.recordTrace";

  public static EvaluationOptions defaults() {
    return new EvaluationOptions(true, true);
  }

  public static EvaluationOptions normalize(EvaluationOptions options) {
    return options == null ? defaults() : options;
  }

  /**
   * Defaults overridden by the system properties {@value #VERIFY_VALUE_TYPES_PROPERTY} and {@value
   * #RECORD_TRACE_PROPERTY} when they are set.
   */
  public static EvaluationOptions fromSystemProperties() {
    EvaluationOptions defaults = defaults();
    return new EvaluationOptions(
        flag(VERIFY_VALUE_TYPES_PROPERTY, defaults.verifyValueTypes()),
        flag(RECORD_TRACE_PROPERTY, defaults.recordTrace()));
  }

  public EvaluationOptions withVerifyValueTypes(boolean verify) {
    return new EvaluationOptions(verify, recordTrace);
  }

  public EvaluationOptions withRecordTrace(boolean trace) {
    return new EvaluationOptions(verifyValueTypes, trace);
  }

  private static boolean flag(String property, boolean fallback) {
    String raw = System.getProperty(property);
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    return Boolean.parseBoolean(raw.trim());
  }
}
