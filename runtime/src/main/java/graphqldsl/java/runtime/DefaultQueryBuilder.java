package graphqldsl.java.runtime;

import graphql.ExecutionInput;
import graphql.ExecutionResult;
import graphql.GraphQL;
import graphqldsl.java.api.QueryBuilder;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** {@link QueryBuilder} that executes against a graphql-java {@link GraphQL} instance. */
final class DefaultQueryBuilder implements QueryBuilder {

  private static final Logger LOG = LoggerFactory.getLogger(DefaultQueryBuilder.class);

  private final GraphQL graphQL;
  private String query = "";

  // LinkedHashMap keeps explicit nulls; containsKey tells them apart from unset variables
  private final Map<String, @Nullable Object> variables = new LinkedHashMap<>();
  private final Map<Object, Object> graphQLContext = new LinkedHashMap<>();
  private @Nullable Object context;
  private @Nullable Consumer<ExecutionInput.Builder> configurer;

  DefaultQueryBuilder(GraphQL graphQL) {
    this.graphQL = Objects.requireNonNull(graphQL, "graphQL");
  }

  @Override
  public QueryBuilder query(String query) {
    this.query = Objects.requireNonNull(query, "query");
    return this;
  }

  @Override
  public QueryBuilder queryFromFile(String resourceName) {
    Objects.requireNonNull(resourceName, "resourceName");
    ClassLoader loader = Thread.currentThread().getContextClassLoader();
    if (loader == null) {
      loader = DefaultQueryBuilder.class.getClassLoader();
    }
    try (InputStream in = loader.getResourceAsStream(resourceName)) {
      if (in == null) {
        throw new IllegalArgumentException("Query resource not found on classpath: " + resourceName);
      }
      LOG.debug("Loading query from resource {}", resourceName);
      return query(new String(in.readAllBytes(), StandardCharsets.UTF_8));
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read query resource: " + resourceName, e);
    }
  }

  @Override
  public QueryBuilder variable(String name, @Nullable Object value) {
    variables.put(Objects.requireNonNull(name, "name"), value);
    return this;
  }

  @Override
  public QueryBuilder variables(Map<String, ? extends @Nullable Object> variables) {
    variables.forEach(this::variable);
    return this;
  }

  @Override
  public QueryBuilder context(Object context) {
    this.context = Objects.requireNonNull(context, "context");
    return this;
  }

  @Override
  public QueryBuilder graphQLContext(Object key, Object value) {
    graphQLContext.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
    return this;
  }

  @Override
  public QueryBuilder configure(Consumer<ExecutionInput.Builder> configurer) {
    this.configurer = Objects.requireNonNull(configurer, "configurer");
    return this;
  }

  /** Executes the query once. Anything the engine throws propagates unchanged. */
  DefaultResultActions execute() {
    LOG.debug("Executing query with variables {}: {}", variables.keySet(), query);
    ExecutionResult result = graphQL.execute(this::applyTo);
    LOG.debug("Query returned {} error(s)", result.getErrors().size());
    return new DefaultResultActions(result);
  }

  private ExecutionInput.Builder applyTo(ExecutionInput.Builder input) {
    input.query(query);
    // an empty map is not sent; the engine distinguishes it from no variables at all
    if (!variables.isEmpty()) {
      input.variables(new LinkedHashMap<>(variables));
    }
    if (context != null) {
      input.context(context);
    }
    if (!graphQLContext.isEmpty()) {
      input.graphQLContext(graphQLContext);
    }
    if (configurer != null) {
      configurer.accept(input);
    }
    return input;
  }
}
