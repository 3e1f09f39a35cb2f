package org.aascore.codegen.intermediate.construction;

import org.aascore.codegen.common.Identifier;
import org.aascore.codegen.common.SourceSpan;

import java.util.Objects;

/**
 * The value a constructor assigns to a property when the argument is {@code None}.
 */
public sealed interface ConstructorDefault {

    SourceSpan span();

    /**
     * {@code arg if arg is not None else []}
     */
    record EmptyList(SourceSpan span) implements ConstructorDefault {
    }

    /**
     * {@code arg if arg is not None else SomeEnum.LITERAL}
     */
    record EnumLiteral(Identifier enumeration, Identifier literal, SourceSpan span) implements ConstructorDefault {

        public EnumLiteral {
            Objects.requireNonNull(enumeration, "Enumeration cannot be null");
            Objects.requireNonNull(literal, "Literal cannot be null");
        }
    }
}
