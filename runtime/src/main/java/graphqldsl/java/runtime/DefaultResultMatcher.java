package graphqldsl.java.runtime;

import graphql.ExecutionResult;
import graphql.GraphQLError;
import graphqldsl.java.api.ResultMatcher;
import graphqldsl.java.api.json.JsonPathResultMatcher;
import graphqldsl.java.api.json.JsonResultMatcher;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;
import org.jspecify.annotations.Nullable;
import org.opentest4j.AssertionFailedError;

final class DefaultResultMatcher implements ResultMatcher {

  private final ExecutionResult executionResult;
  private final Supplier<JsonPathContext> jsonPathContext;

  DefaultResultMatcher(ExecutionResult executionResult, Supplier<JsonPathContext> jsonPathContext) {
    this.executionResult = executionResult;
    this.jsonPathContext = jsonPathContext;
  }

  @Override
  public ResultMatcher noErrors() {
    List<GraphQLError> errors = executionResult.getErrors();
    if (!errors.isEmpty()) {
      throw new AssertionFailedError(FailureMessages.unexpectedErrors(errors), List.of(), errors);
    }
    return this;
  }

  @Override
  public ResultMatcher rootFieldEqualTo(String key, @Nullable Object expected) {
    Object data = executionResult.getData();
    if (!(data instanceof Map<?, ?> root)) {
      throw new IllegalStateException(FailureMessages.rootNotAMap(data));
    }
    Object actual = root.get(key);
    if (!Objects.equals(expected, actual)) {
      throw new AssertionFailedError(FailureMessages.rootFieldMismatch(key), expected, actual);
    }
    return this;
  }

  @Override
  public ResultMatcher withJson(Consumer<JsonResultMatcher> fn) {
    fn.accept(json());
    return this;
  }

  @Override
  public <R extends @Nullable Object> R asJson(Function<JsonResultMatcher, R> fn) {
    return fn.apply(json());
  }

  @Override
  public <T extends @Nullable Object> ResultMatcher path(
      String path, Consumer<JsonPathResultMatcher<T>> fn) {
    json().path(path, fn);
    return this;
  }

  @Override
  public <T extends @Nullable Object, R extends @Nullable Object> R onPath(
      String path, Function<JsonPathResultMatcher<T>, R> fn) {
    return json().onPath(path, fn);
  }

  @Override
  public ResultMatcher pathIsEqualTo(String path, @Nullable Object expected) {
    json().pathIsEqualTo(path, expected);
    return this;
  }

  @Override
  public <T extends @Nullable Object, R extends @Nullable Object> R doWithPath(
      String path, Function<T, R> fn) {
    return json().doWithPath(path, fn);
  }

  private JsonResultMatcher json() {
    return new DefaultJsonResultMatcher(jsonPathContext.get());
  }
}
