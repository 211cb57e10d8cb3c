package graphqldsl.java.runtime;

import graphql.GraphQLError;
import java.util.List;
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;

/** Texts of the assertion failures raised by the matchers. */
final class FailureMessages {

  static final String QUOTE = ">> ";

  private FailureMessages() {}

  /**
   * Lists the error messages, each line quoted with {@code ">> "} and blocks separated by a
   * {@code ">"} line.
   */
  static String unexpectedErrors(List<? extends GraphQLError> errors) {
    String quoted =
        errors.stream()
            .map(error -> quote(String.valueOf(error.getMessage())))
            .collect(Collectors.joining("\n>\n"));
    return "Expected no errors in the result.\n\nIt got these errors:\n\n" + quoted + "\n";
  }

  static String rootFieldMismatch(String key) {
    return "Expected field with key: " + key;
  }

  static String rootNotAMap(@Nullable Object data) {
    return "Expected root data to be a map and contain field(s), but was: " + data;
  }

  static String pathMismatch(String path, @Nullable Object data) {
    return "No match for path: " + path + "\n\nIn data: " + data;
  }

  static String quote(String message) {
    if (message.isEmpty()) {
      return QUOTE;
    }
    return message.lines().map(line -> QUOTE + line).collect(Collectors.joining("\n"));
  }
}
