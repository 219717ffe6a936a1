package org.srcgen.ast.expr;

import org.srcgen.ast.Node;
import org.srcgen.ast.visitor.VoidVisitor;

import java.util.List;

/**
 * {@code lower:upper:step}; every bound is optional.
 */
public class SliceExpr extends Expression {

    private final Expression lower;
    private final Expression upper;
    private final Expression step;

    public SliceExpr(Expression lower, Expression upper, Expression step) {
        super(0);
        this.lower = lower;
        this.upper = upper;
        this.step = step;
    }

    public Expression getLower() {
        return lower;
    }

    public Expression getUpper() {
        return upper;
    }

    public Expression getStep() {
        return step;
    }

    @Override
    public List<Node> getChildNodes() {
        return childrenOf(lower, upper, step);
    }

    @Override
    public <A> void accept(VoidVisitor<A> v, A arg) {
        v.visit(this, arg);
    }
}
