package graphqldsl.java.runtime;

import graphqldsl.java.api.json.JsonPathResultMatcher;
import graphqldsl.java.api.json.JsonResultMatcher;
import java.util.function.Consumer;
import java.util.function.Function;
import org.jspecify.annotations.Nullable;

final class DefaultJsonResultMatcher implements JsonResultMatcher {

  private final JsonPathContext context;

  DefaultJsonResultMatcher(JsonPathContext context) {
    this.context = context;
  }

  @Override
  public <T extends @Nullable Object> JsonResultMatcher path(
      String path, Consumer<JsonPathResultMatcher<T>> fn) {
    fn.accept(this.<T>at(path));
    return this;
  }

  @Override
  public <T extends @Nullable Object, R extends @Nullable Object> R onPath(
      String path, Function<JsonPathResultMatcher<T>, R> fn) {
    return fn.apply(this.<T>at(path));
  }

  @Override
  public JsonResultMatcher pathIsEqualTo(String path, @Nullable Object expected) {
    return this.<Object>path(path, value -> value.isEqualTo(expected));
  }

  @Override
  public <T extends @Nullable Object, R extends @Nullable Object> R doWithPath(
      String path, Function<T, R> fn) {
    return this.<T, R>onPath(path, value -> value.andDo(fn));
  }

  @Override
  public <R extends @Nullable Object> R doWithJsonString(Function<String, R> fn) {
    return fn.apply(context.json());
  }

  private <T extends @Nullable Object> JsonPathResultMatcher<T> at(String path) {
    T value = context.read(path);
    return new DefaultJsonPathResultMatcher<>(path, context.data(), value);
  }
}
