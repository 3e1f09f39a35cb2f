package org.aascore.codegen.parse;

import org.aascore.codegen.common.Identifier;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A type annotation as written in the meta-model, before any name is resolved.
 *
 * Two type expressions are equal when they have the same shape, regardless of
 * where they were written; for every type that can be written in the source,
 * {@link #print()} yields text that parses back to an equal value.
 */
public sealed interface TypeExpression {

    String print();

    /**
     * A plain name such as {@code str} or {@code Reference}.
     */
    record Atomic(Identifier identifier) implements TypeExpression {

        public Atomic {
            Objects.requireNonNull(identifier, "Type identifier cannot be null");
        }

        @Override
        public String print() {
            return identifier.value();
        }
    }

    /**
     * A generic such as {@code Optional[List[Key]]}.
     */
    record Subscripted(Identifier identifier, List<TypeExpression> subscripts) implements TypeExpression {

        public Subscripted {
            Objects.requireNonNull(identifier, "Type identifier cannot be null");
            subscripts = List.copyOf(subscripts);
            if (subscripts.isEmpty()) {
                throw new IllegalArgumentException("A subscripted type needs at least one subscript");
            }
        }

        @Override
        public String print() {
            return identifier.value() + subscripts.stream()
                    .map(TypeExpression::print)
                    .collect(Collectors.joining(", ", "[", "]"));
        }
    }

    /**
     * The implicit type of the {@code self} argument.
     */
    record SelfType() implements TypeExpression {

        @Override
        public String print() {
            return "SELF";
        }
    }
}
