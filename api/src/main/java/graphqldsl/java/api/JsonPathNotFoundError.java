package graphqldsl.java.api;

import org.jspecify.annotations.Nullable;

/**
 * Thrown when a JSONPath expression does not resolve against the result data.
 *
 * <p>Not an {@code AssertionFailedError}, so an absent value can be told apart from a value that
 * differs from the expectation.
 */
public class JsonPathNotFoundError extends AssertionError {

  private static final long serialVersionUID = 1L;

  private final String path;
  private final transient @Nullable Object data;

  public JsonPathNotFoundError(String path, @Nullable Object data) {
    this(path, data, null);
  }

  public JsonPathNotFoundError(String path, @Nullable Object data, @Nullable Throwable cause) {
    super("No results for path: " + path + "\n\nIn data: " + data, cause);
    this.path = path;
    this.data = data;
  }

  /** The expression that did not resolve. */
  public String getPath() {
    return path;
  }

  /** The result data the expression was evaluated against. */
  public @Nullable Object getData() {
    return data;
  }
}
