/**
 * The JSONPath part of the DSL.
 *
 * <p>{@link graphqldsl.java.api.json.JsonResultMatcher} works on the JSON serialization of the
 * result data, {@link graphqldsl.java.api.json.JsonPathResultMatcher} on the value found at one
 * path.
 */
@NullMarked
package graphqldsl.java.api.json;

import org.jspecify.annotations.NullMarked;
