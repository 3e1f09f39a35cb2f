package org.aascore.codegen.parse.tree;

/**
 * A node of the expression tree used for invariants, contracts and snapshots.
 */
public sealed interface TreeNode permits Expression, Declaration {

    <T> T accept(TreeVisitor<T> visitor);
}
