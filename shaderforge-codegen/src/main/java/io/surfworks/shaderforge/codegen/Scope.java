package io.surfworks.shaderforge.codegen;

import io.surfworks.shaderforge.graph.Node;

/**
 * A lexical block of the generated {@code main} body.
 *
 * <p>The root scope is the function body. Every conditional node opens two
 * child scopes, one per branch, under the scope the conditional is placed in.
 */
final class Scope {

    enum Branch { THEN, ELSE }

    private final Scope parent;
    private final Node owner;
    private final Branch branch;
    private final int depth;
    private final int index;

    private Scope(Scope parent, Node owner, Branch branch, int depth, int index) {
        this.parent = parent;
        this.owner = owner;
        this.branch = branch;
        this.depth = depth;
        this.index = index;
    }

    static Scope root() {
        return new Scope(null, null, null, 0, 0);
    }

    /**
     * Opens a branch scope of {@code conditional} inside this scope.
     *
     * @param index creation number, unique within one compilation
     */
    Scope branch(Node conditional, Branch branch, int index) {
        return new Scope(this, conditional, branch, depth + 1, index);
    }

    /**
     * The innermost scope enclosing both arguments.
     */
    static Scope commonAncestor(Scope a, Scope b) {
        while (a.depth > b.depth) {
            a = a.parent;
        }
        while (b.depth > a.depth) {
            b = b.parent;
        }
        while (a != b) {
            a = a.parent;
            b = b.parent;
        }
        return a;
    }

    /**
     * True if {@code other} is this scope or nested inside it.
     */
    boolean encloses(Scope other) {
        Scope s = other;
        while (s != null && s.depth >= depth) {
            if (s == this) {
                return true;
            }
            s = s.parent;
        }
        return false;
    }

    boolean isRoot() {
        return parent == null;
    }

    Scope parent() {
        return parent;
    }

    /**
     * The conditional whose branch this is; null for the root scope.
     */
    Node owner() {
        return owner;
    }

    Branch branch() {
        return branch;
    }

    int depth() {
        return depth;
    }

    @Override
    public String toString() {
        return isRoot() ? "Scope[root]" : "Scope[" + index + ": " + branch + " of #" + owner.id() + "]";
    }
}
