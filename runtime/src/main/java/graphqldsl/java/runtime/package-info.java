/**
 * graphql-java backed implementation of the GraphQL test DSL.
 *
 * <p>{@link graphqldsl.java.runtime.GraphQLTest} is the entry point. Everything else in this
 * package is an implementation detail behind the {@code graphqldsl.java.api} interfaces.
 */
@NullMarked
package graphqldsl.java.runtime;

import org.jspecify.annotations.NullMarked;
