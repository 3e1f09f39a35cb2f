package org.aascore.codegen.intermediate.construction;

import org.aascore.codegen.common.Identifier;
import org.aascore.codegen.common.SourceSpan;

import java.util.Objects;

/**
 * One understood statement of a constructor body.
 */
public sealed interface ConstructorStatement {

    SourceSpan span();

    /**
     * A call to the constructor of a direct parent which forwards the arguments unchanged.
     *
     * @param superName The parent whose constructor is called
     */
    record CallSuperConstructor(Identifier superName, SourceSpan span) implements ConstructorStatement {

        public CallSuperConstructor {
            Objects.requireNonNull(superName, "Super class name cannot be null");
        }
    }

    /**
     * An assignment of a constructor argument to a property.
     *
     * @param name         The property
     * @param argument     The argument assigned to it
     * @param defaultValue Value assigned if the argument is {@code None}, or null
     */
    record AssignArgument(Identifier name, Identifier argument, ConstructorDefault defaultValue, SourceSpan span)
            implements ConstructorStatement {

        public AssignArgument {
            Objects.requireNonNull(name, "Property name cannot be null");
            Objects.requireNonNull(argument, "Argument name cannot be null");
        }
    }
}
