package org.aascore.codegen.parse.tree;

import java.util.Objects;

/**
 * {@code antecedent => consequent}, written as {@code not antecedent or consequent}.
 */
public record Implication(Expression antecedent, Expression consequent) implements Expression {

    public Implication {
        Objects.requireNonNull(antecedent, "Antecedent cannot be null");
        Objects.requireNonNull(consequent, "Consequent cannot be null");
    }

    @Override
    public <T> T accept(TreeVisitor<T> visitor) {
        return visitor.visitImplication(this);
    }
}
