package graphqldsl.java.api;

import graphql.ExecutionInput;
import java.util.Map;
import java.util.function.Consumer;
import org.jspecify.annotations.Nullable;

/**
 * Collects the inputs of a single GraphQL execution.
 *
 * <p>A builder is handed to the configuration block of the test entry point and is executed once
 * that block returns. Nothing is validated while building: syntax errors in the query, unknown
 * variables and the like surface as errors of the execution result.
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * graphQLTest(graphQL, q -> q
 *     .query("query($id: ID!) { user(id: $id) { name } }")
 *     .variable("id", "u-1")
 *     .context(currentUser))
 *   .andExpect(r -> r.noErrors());
 * }</pre>
 */
public interface QueryBuilder {

  /**
   * Replaces the query document.
   *
   * @param query the GraphQL document text
   * @return this builder
   */
  QueryBuilder query(String query);

  /**
   * Replaces the query document with the contents of a classpath resource, read as UTF-8.
   *
   * @param resourceName the resource name, e.g. {@code "queries/user.graphql"}
   * @return this builder
   * @throws IllegalArgumentException if no resource with that name exists
   */
  QueryBuilder queryFromFile(String resourceName);

  /**
   * Binds a variable. A {@code null} value is sent as an explicit null, which is not the same as
   * leaving the variable unset.
   *
   * @param name the variable name, without the leading {@code $}
   * @param value the value, possibly {@code null}
   * @return this builder
   */
  QueryBuilder variable(String name, @Nullable Object value);

  /**
   * Binds all entries of the given map, overwriting variables with the same name.
   *
   * @param variables variables by name; values may be {@code null}
   * @return this builder
   */
  QueryBuilder variables(Map<String, ? extends @Nullable Object> variables);

  /**
   * Sets the context object that is handed unmodified to the data fetchers of this execution.
   *
   * @param context the context object
   * @return this builder
   */
  QueryBuilder context(Object context);

  /**
   * Puts an entry into the {@link graphql.GraphQLContext} of this execution.
   *
   * @param key the context key
   * @param value the context value
   * @return this builder
   */
  QueryBuilder graphQLContext(Object key, Object value);

  /**
   * Registers a hook that receives the engine's own input builder. It runs after the query,
   * variables and context of this builder have been applied, so anything it sets wins.
   *
   * @param configurer the hook
   * @return this builder
   * @see ExecutionInput.Builder
   */
  QueryBuilder configure(Consumer<ExecutionInput.Builder> configurer);
}
