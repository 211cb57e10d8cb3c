/**
 * Public contracts of the GraphQL test DSL.
 *
 * <p>A test starts with a {@link graphqldsl.java.api.QueryBuilder}, which is executed against a
 * graphql-java engine and yields {@link graphqldsl.java.api.ResultActions}. Assertions are written
 * in {@link graphqldsl.java.api.ResultMatcher} blocks.
 *
 * <p>All types in this package are non-null by default unless explicitly annotated with {@link
 * org.jspecify.annotations.Nullable @Nullable}.
 */
@NullMarked
package graphqldsl.java.api;

import org.jspecify.annotations.NullMarked;
