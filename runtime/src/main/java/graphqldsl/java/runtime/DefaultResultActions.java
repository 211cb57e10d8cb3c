package graphqldsl.java.runtime;

import graphql.ExecutionResult;
import graphqldsl.java.api.ResultActions;
import graphqldsl.java.api.ResultMatcher;
import graphqldsl.java.api.json.JsonResultMatcher;
import java.util.Objects;
import java.util.function.Consumer;
import org.jspecify.annotations.Nullable;

/** Wraps an {@link ExecutionResult} and owns its lazily built JSON view. */
final class DefaultResultActions implements ResultActions {

  private final ExecutionResult executionResult;
  private @Nullable JsonPathContext jsonPathContext;

  DefaultResultActions(ExecutionResult executionResult) {
    this.executionResult = Objects.requireNonNull(executionResult, "executionResult");
  }

  @Override
  public ResultActions andExpect(Consumer<ResultMatcher> expectations) {
    expectations.accept(new DefaultResultMatcher(executionResult, this::jsonPathContext));
    return this;
  }

  @Override
  public ResultActions andExpectJson(Consumer<JsonResultMatcher> expectations) {
    return andExpect(matcher -> matcher.withJson(expectations));
  }

  @Override
  public ResultActions andDo(Consumer<ExecutionResult> action) {
    action.accept(executionResult);
    return this;
  }

  @Override
  public ExecutionResult andReturn() {
    return executionResult;
  }

  @Override
  public <T extends @Nullable Object> T andReturnPath(String path) {
    return jsonPathContext().read(path);
  }

  /** Serializes the result data on first use; later calls reuse the same document. */
  JsonPathContext jsonPathContext() {
    JsonPathContext context = jsonPathContext;
    if (context == null) {
      context = new JsonPathContext(executionResult.getData());
      jsonPathContext = context;
    }
    return context;
  }
}
