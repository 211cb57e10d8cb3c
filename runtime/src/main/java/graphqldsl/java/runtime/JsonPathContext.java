package graphqldsl.java.runtime;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.jayway.jsonpath.Configuration;
import com.jayway.jsonpath.DocumentContext;
import com.jayway.jsonpath.JsonPath;
import com.jayway.jsonpath.PathNotFoundException;
import graphqldsl.java.api.JsonPathNotFoundError;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JSON serialization of the result data, parsed once for repeated JSONPath reads.
 *
 * <p>Nulls are serialized explicitly, so a field resolved to null reads as {@code null} and is not
 * reported as missing.
 */
final class JsonPathContext {

  private static final Logger LOG = LoggerFactory.getLogger(JsonPathContext.class);

  private static final Gson GSON =
      new GsonBuilder().serializeNulls().disableHtmlEscaping().create();
  private static final Configuration CONFIGURATION = Configuration.defaultConfiguration();

  private final @Nullable Object data;
  private final String json;
  private final @Nullable DocumentContext document;

  JsonPathContext(@Nullable Object data) {
    this.data = data;
    this.json = GSON.toJson(data);
    // JsonPath rejects a null document; without data no path can resolve
    this.document = data == null ? null : JsonPath.using(CONFIGURATION).parse(json);
    LOG.debug("Serialized result data to {} characters of JSON", json.length());
  }

  @Nullable Object data() {
    return data;
  }

  String json() {
    return json;
  }

  /**
   * Reads the value at {@code path}.
   *
   * @throws JsonPathNotFoundError if the path does not resolve
   * @throws com.jayway.jsonpath.InvalidPathException if the expression is malformed
   */
  <T extends @Nullable Object> T read(String path) {
    if (document == null) {
      throw new JsonPathNotFoundError(path, data);
    }
    try {
      return document.read(path);
    } catch (PathNotFoundException e) {
      throw new JsonPathNotFoundError(path, data, e);
    }
  }
}
