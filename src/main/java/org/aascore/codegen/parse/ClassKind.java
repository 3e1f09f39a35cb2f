package org.aascore.codegen.parse;

public enum ClassKind {
    ABSTRACT,
    CONCRETE
}
