package graphqldsl.java.api.json;

import java.util.function.Function;
import org.jspecify.annotations.Nullable;

/**
 * Expectations on the value found at one JSONPath expression.
 *
 * @param <T> the type of the value
 */
public interface JsonPathResultMatcher<T extends @Nullable Object> {

  /** The path this value was read from. */
  String path();

  /** The value found at the path. */
  T read();

  /**
   * Passes the value to {@code fn}.
   *
   * @param fn the function receiving the value
   * @param <R> the type of the derived value
   * @return whatever {@code fn} returns
   */
  <R extends @Nullable Object> R andDo(Function<? super T, ? extends R> fn);

  /**
   * Asserts that the value equals {@code expected}. Lists and maps compare by content.
   *
   * @param expected the expected value
   * @return this matcher
   */
  JsonPathResultMatcher<T> isEqualTo(@Nullable Object expected);
}
