package org.aascore.codegen.parse.tree;

import org.aascore.codegen.common.Identifier;

import java.util.Objects;

public record KeywordArgument(Identifier arg, Expression value) {

    public KeywordArgument {
        Objects.requireNonNull(arg, "Keyword cannot be null");
        Objects.requireNonNull(value, "Keyword value cannot be null");
    }
}
