package graphqldsl.java.api;

import graphqldsl.java.api.json.JsonPathResultMatcher;
import graphqldsl.java.api.json.JsonResultMatcher;
import java.util.function.Consumer;
import java.util.function.Function;
import org.jspecify.annotations.Nullable;

/**
 * Expectations on a single execution result.
 *
 * <p>Assertion failures are reported as {@code org.opentest4j.AssertionFailedError}, which test
 * runners render with an expected/actual diff. A path that does not resolve is reported as {@link
 * JsonPathNotFoundError} instead, so a missing value is never confused with a wrong one.
 *
 * <p>All path based methods share one JSON view of the result data, which is serialized on first
 * use. Several paths can also be checked inside one {@link #withJson(Consumer)} block.
 */
public interface ResultMatcher {

  /**
   * Asserts that the result carries no GraphQL errors.
   *
   * @return this matcher
   */
  ResultMatcher noErrors();

  /**
   * Asserts that the root data object holds {@code expected} under {@code key}. Values are
   * compared with {@link Object#equals(Object)}, so {@code 42} and {@code "42"} differ.
   *
   * @param key the root field name or alias
   * @param expected the expected value
   * @return this matcher
   * @throws IllegalStateException if the result data is not an object
   */
  ResultMatcher rootFieldEqualTo(String key, @Nullable Object expected);

  /**
   * Runs a block against the JSON view of the result data.
   *
   * @param fn the block
   * @return this matcher
   */
  ResultMatcher withJson(Consumer<JsonResultMatcher> fn);

  /**
   * Runs a function against the JSON view of the result data and returns its result.
   *
   * @param fn the function
   * @param <R> the type of the derived value
   * @return whatever {@code fn} returns
   */
  <R extends @Nullable Object> R asJson(Function<JsonResultMatcher, R> fn);

  /**
   * Runs a block against the value at a JSONPath expression.
   *
   * @param path the JSONPath expression
   * @param fn the block
   * @param <T> the expected type of the value
   * @return this matcher
   * @throws JsonPathNotFoundError if the path does not resolve
   */
  <T extends @Nullable Object> ResultMatcher path(
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
   * @param expected the expected value; lists and maps compare by content
   * @return this matcher
   * @throws JsonPathNotFoundError if the path does not resolve
   */
  ResultMatcher pathIsEqualTo(String path, @Nullable Object expected);

  /**
   * Passes the value at a JSONPath expression to {@code fn}, e.g. to run custom assertions.
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
}
