package graphqldsl.java.runtime;

import static graphqldsl.java.runtime.GraphQLTest.graphQLTest;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import graphql.ExecutionResult;
import graphql.GraphQL;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class DefaultQueryBuilderTest {

  private static final String ECHO_WITH_DEFAULT =
      "query($echo: String = \"fallback\") { echo(echo: $echo) }";

  private final GraphQL graphQL = TestSchemas.graphQL();

  @Test
  void unsetVariableUsesDefaultValue() {
    graphQLTest(graphQL, q -> q.query(ECHO_WITH_DEFAULT))
        .andExpect(r -> r.noErrors().rootFieldEqualTo("echo", "fallback"));
  }

  @Test
  void nullVariableOverridesDefaultValue() {
    graphQLTest(graphQL, q -> q.query(ECHO_WITH_DEFAULT).variable("echo", null))
        .andExpect(r -> r.noErrors().rootFieldEqualTo("echo", null));
  }

  @Test
  void mergedVariablesOverwriteEarlierOnes() {
    Map<String, Object> variables = new HashMap<>();
    variables.put("echo", "merged");

    graphQLTest(
            graphQL,
            q -> q.query(ECHO_WITH_DEFAULT).variable("echo", "first").variables(variables))
        .andExpect(r -> r.noErrors().rootFieldEqualTo("echo", "merged"));
  }

  @Test
  void lastQueryWins() {
    graphQLTest(graphQL, q -> q.query("{ hello }").query("{ answer }"))
        .andExpect(r -> r.noErrors().rootFieldEqualTo("answer", 42));
  }

  @Test
  void forwardsContextToDataFetchers() {
    graphQLTest(graphQL, q -> q.query("{ contextValue }").context("request-context"))
        .andExpect(r -> r.noErrors().rootFieldEqualTo("contextValue", "request-context"));
  }

  @Test
  void putsEntriesIntoGraphQLContext() {
    graphQLTest(graphQL, q -> q.query("{ graphQLContextValue }").graphQLContext("tenant", "acme"))
        .andExpect(r -> r.noErrors().rootFieldEqualTo("graphQLContextValue", "acme"));
  }

  @Test
  void configureHookRunsLast() {
    graphQLTest(
            graphQL,
            q ->
                q.configure(input -> input.query(ECHO_WITH_DEFAULT).variables(Map.of("echo", "raw")))
                    .query("{ hello }")
                    .variable("echo", "ignored"))
        .andExpect(r -> r.noErrors().rootFieldEqualTo("echo", "raw"));
  }

  @Test
  void runsQueryWithoutVariables() {
    ExecutionResult result = graphQLTest(graphQL, q -> q.query("{ hello }")).andReturn();

    assertThat(result.getErrors()).isEmpty();
    assertThat(result.<Map<String, Object>>getData()).containsEntry("hello", "world");
  }

  @Test
  void readsQueryFromClasspathResource() {
    graphQLTest(graphQL, q -> q.queryFromFile("queries/answer.graphql"))
        .andExpect(r -> r.noErrors().rootFieldEqualTo("answer", 42));

    graphQLTest(graphQL, q -> q.queryFromFile("queries/echo.graphql").variable("echo", "file"))
        .andExpect(r -> r.noErrors().pathIsEqualTo("$.echo", "file"));
  }

  @Test
  void missingQueryResourceIsRejected() {
    assertThatThrownBy(() -> graphQLTest(graphQL, q -> q.queryFromFile("queries/missing.graphql")))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("queries/missing.graphql");
  }
}
