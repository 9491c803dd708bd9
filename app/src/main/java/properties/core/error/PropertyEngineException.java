package properties.core.error;

/** Root of every failure raised while building a schema or evaluating it. */
public class PropertyEngineException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  public PropertyEngineException(String message) {
    super(message);
  }

  public PropertyEngineException(String message, Throwable cause) {
    super(message, cause);
  }
}
