package graphqldsl.java.api;

import graphql.ExecutionResult;
import graphqldsl.java.api.json.JsonResultMatcher;
import java.util.function.Consumer;
import org.jspecify.annotations.Nullable;

/**
 * The outcome of an executed query, open for expectations and inspection.
 *
 * <p>Every method except the {@code andReturn} variants returns this instance so that calls chain:
 *
 * <pre>{@code
 * String name =
 *     graphQLTest(graphQL, q -> q.query("{ user { name } }"))
 *         .andExpect(r -> r.noErrors())
 *         .andExpectJson(json -> json.pathIsEqualTo("$.user.name", "Ada"))
 *         .andReturnPath("$.user.name");
 * }</pre>
 */
public interface ResultActions {

  /**
   * Runs a block of expectations against the result.
   *
   * @param expectations the expectation block
   * @return this instance
   */
  ResultActions andExpect(Consumer<ResultMatcher> expectations);

  /**
   * Runs a block of expectations against the JSON view of the result data.
   *
   * @param expectations the expectation block
   * @return this instance
   */
  ResultActions andExpectJson(Consumer<JsonResultMatcher> expectations);

  /**
   * Runs an arbitrary action against the raw execution result.
   *
   * @param action the action
   * @return this instance
   */
  ResultActions andDo(Consumer<ExecutionResult> action);

  /**
   * Returns the raw execution result.
   *
   * @return the result produced by the engine
   */
  ExecutionResult andReturn();

  /**
   * Returns the value at a JSONPath expression in the result data.
   *
   * @param path the JSONPath expression, e.g. {@code "$.user.name"}
   * @param <T> the expected type of the value
   * @return the value, possibly {@code null} when the data holds an explicit null
   * @throws JsonPathNotFoundError if the path does not resolve
   */
  <T extends @Nullable Object> T andReturnPath(String path);
}
