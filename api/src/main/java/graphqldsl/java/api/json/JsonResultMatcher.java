package graphqldsl.java.api.json;

import graphqldsl.java.api.JsonPathNotFoundError;
import java.util.function.Consumer;
import java.util.function.Function;
import org.jspecify.annotations.Nullable;

/**
 * Expectations on the JSON serialization of the result data.
 *
 * <p>The data is serialized once, with explicit nulls kept, and every path in this scope is
 * evaluated against that same document.
 *
 * <pre>{@code
 * r.withJson(json -> {
 *   json.pathIsEqualTo("$.user.name", "Ada");
 *   json.path("$.user.roles", roles -> roles.isEqualTo(List.of("admin")));
 * });
 * }</pre>
 */
public interface JsonResultMatcher {

  /**
   * Runs a block against the value at a JSONPath expression.
   *
   * @param path the JSONPath expression
   * @param fn the block
   * @param <T> the expected type of the value
   * @return this matcher
   * @throws JsonPathNotFoundError if the path does not resolve
   */
  <T extends @Nullable Object> JsonResultMatcher path(
      String path, Consumer<JsonPathResultMatcher<T>> fn);

  /**
   * Runs a function against the value at a JSONPath expression and returns its result.
   *
   * @param path the JSONPath expression
   * @param fn the function
   * @param <T> the expected type of the value
   * @param <R> the type of the derived value
   * @return whatever {@code fn} returns
   * @throws JsonPathNotFoundError if the path does not resolve
   */
  <T extends @Nullable Object, R extends @Nullable Object> R onPath(
      String path, Function<JsonPathResultMatcher<T>, R> fn);

  /**
   * Asserts that the value at a JSONPath expression equals {@code expected}.
   *
   * @param path the JSONPath expression
   * @param expected the expected value
   * @return this matcher
   * @throws JsonPathNotFoundError if the path does not resolve
   */
  JsonResultMatcher pathIsEqualTo(String path, @Nullable Object expected);

  /**
   * Passes the value at a JSONPath expression to {@code fn}.
   *
   * @param path the JSONPath expression
   * @param fn the function receiving the value
   * @param <T> the expected type of the value
   * @param <R> the type of the derived value
   * @return whatever {@code fn} returns
   * @throws JsonPathNotFoundError if the path does not resolve
   */
  <T extends @Nullable Object, R extends @Nullable Object> R doWithPath(
      String path, Function<T, R> fn);

  /**
   * Passes the serialized JSON text to {@code fn}, for assertions on the exact rendering.
   *
   * @param fn the function receiving the JSON text
   * @param <R> the type of the derived value
   * @return whatever {@code fn} returns
   */
  <R extends @Nullable Object> R doWithJsonString(Function<String, R> fn);
}
