package org.srcgen.ast;

import org.srcgen.ast.visitor.VoidVisitor;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Base class of every element of a parsed syntax tree.
 * <p>
 * Nodes are immutable and externally supplied. Each concrete kind exposes its own typed fields
 * plus {@link #getChildNodes()}, which lists the child nodes in declaration order so that a
 * visitor without a kind-specific handler can still recurse generically.
 */
public abstract class Node {

    private final int line;

    protected Node(int line) {
        this.line = line;
    }

    /**
     * @return the source line this node was parsed from, or {@code 0} when unknown
     */
    public int getLine() {
        return line;
    }

    /**
     * @return the simple kind name of this node, used in diagnostics and error messages
     */
    public String getKind() {
        return getClass().getSimpleName();
    }

    public abstract List<Node> getChildNodes();

    public abstract <A> void accept(VoidVisitor<A> v, A arg);

    /**
     * Flattens the given members into a child list. A member is either a {@link Node}, a
     * collection of nodes, or {@code null} (an absent optional child), which is skipped.
     */
    protected static List<Node> childrenOf(Object... members) {
        List<Node> children = new ArrayList<>();
        for (Object member : members) {
            if (member == null) {
                continue;
            }
            if (member instanceof Node) {
                children.add((Node) member);
            } else if (member instanceof Collection) {
                for (Object element : (Collection<?>) member) {
                    children.add((Node) element);
                }
            } else {
                throw new IllegalArgumentException("Not a child member: " + member.getClass().getName());
            }
        }
        return Collections.unmodifiableList(children);
    }

    protected static <T> List<T> copyOf(List<T> list) {
        return list == null ? List.of() : List.copyOf(list);
    }

    @Override
    public String toString() {
        return getKind() + (line > 0 ? "@" + line : "");
    }
}
