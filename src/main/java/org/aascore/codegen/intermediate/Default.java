package org.aascore.codegen.intermediate;

import org.aascore.codegen.common.Identifier;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Default value of a method or constructor argument.
 */
public sealed interface Default {

    /**
     * A literal: {@code null} for None, or a Boolean, BigInteger, Double or String.
     */
    record DefaultConstant(Object value) implements Default {

        public DefaultConstant {
            if (value != null
                    && !(value instanceof Boolean)
                    && !(value instanceof BigInteger)
                    && !(value instanceof Double)
                    && !(value instanceof String)) {
                throw new IllegalArgumentException("Unsupported default value: " + value.getClass());
            }
        }
    }

    record DefaultEnumerationLiteral(SymbolReference enumeration, Identifier literal) implements Default {

        public DefaultEnumerationLiteral {
            Objects.requireNonNull(enumeration, "Enumeration cannot be null");
            Objects.requireNonNull(literal, "Literal cannot be null");
        }
    }
}
