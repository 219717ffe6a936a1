package org.srcgen.ast;

import org.srcgen.ast.expr.Expression;
import org.srcgen.ast.visitor.VoidVisitor;

import java.util.List;

/**
 * One {@code for target in iter if cond...} clause of a comprehension.
 */
public class Comprehension extends Node {

    private final Expression target;
    private final Expression iter;
    private final List<Expression> ifs;

    public Comprehension(Expression target, Expression iter) {
        this(target, iter, List.of());
    }

    public Comprehension(Expression target, Expression iter, List<Expression> ifs) {
        super(0);
        this.target = target;
        this.iter = iter;
        this.ifs = copyOf(ifs);
    }

    public Expression getTarget() {
        return target;
    }

    public Expression getIter() {
        return iter;
    }

    public List<Expression> getIfs() {
        return ifs;
    }

    @Override
    public List<Node> getChildNodes() {
        return childrenOf(target, iter, ifs);
    }

    @Override
    public <A> void accept(VoidVisitor<A> v, A arg) {
        v.visit(this, arg);
    }
}
