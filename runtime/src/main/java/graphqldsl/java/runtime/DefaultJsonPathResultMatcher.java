package graphqldsl.java.runtime;

import graphqldsl.java.api.json.JsonPathResultMatcher;
import java.util.Objects;
import java.util.function.Function;
import org.jspecify.annotations.Nullable;
import org.opentest4j.AssertionFailedError;

/**
 * The value read at one path, along with the path and the full result data for failure messages.
 */
final class DefaultJsonPathResultMatcher<T extends @Nullable Object>
    implements JsonPathResultMatcher<T> {

  private final String path;
  private final @Nullable Object data;
  private final T value;

  DefaultJsonPathResultMatcher(String path, @Nullable Object data, T value) {
    this.path = path;
    this.data = data;
    this.value = value;
  }

  @Override
  public String path() {
    return path;
  }

  @Override
  public T read() {
    return value;
  }

  @Override
  public <R extends @Nullable Object> R andDo(Function<? super T, ? extends R> fn) {
    return fn.apply(value);
  }

  @Override
  public JsonPathResultMatcher<T> isEqualTo(@Nullable Object expected) {
    if (!Objects.equals(expected, value)) {
      throw new AssertionFailedError(FailureMessages.pathMismatch(path, data), expected, value);
    }
    return this;
  }
}
