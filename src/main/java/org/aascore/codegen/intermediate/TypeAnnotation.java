package org.aascore.codegen.intermediate;

import java.util.Objects;

/**
 * A resolved type annotation of a property, argument or result.
 */
public sealed interface TypeAnnotation {

    /**
     * @return The annotation as it would be written in the meta-model
     */
    String print();

    record Primitive(PrimitiveType type) implements TypeAnnotation {

        public Primitive {
            Objects.requireNonNull(type, "Primitive type cannot be null");
        }

        @Override
        public String print() {
            return type.typeName();
        }
    }

    /**
     * A reference to a class or an enumeration of the meta-model.
     */
    record OurType(SymbolReference reference) implements TypeAnnotation {

        public OurType {
            Objects.requireNonNull(reference, "Symbol reference cannot be null");
        }

        public Symbol symbol() {
            return reference.symbol();
        }

        @Override
        public String print() {
            return reference.name().value();
        }
    }

    record ListType(TypeAnnotation items) implements TypeAnnotation {

        public ListType {
            Objects.requireNonNull(items, "List items cannot be null");
        }

        @Override
        public String print() {
            return "List[" + items.print() + "]";
        }
    }

    record OptionalType(TypeAnnotation value) implements TypeAnnotation {

        public OptionalType {
            Objects.requireNonNull(value, "Optional value cannot be null");
        }

        @Override
        public String print() {
            return "Optional[" + value.print() + "]";
        }
    }
}
