package org.srcgen.ast.expr;

import org.srcgen.ast.Node;
import org.srcgen.ast.visitor.VoidVisitor;

import java.util.List;

public class SubscriptExpr extends Expression {

    private final Expression value;
    private final Expression slice;

    public SubscriptExpr(Expression value, Expression slice) {
        super(0);
        this.value = value;
        this.slice = slice;
    }

    public Expression getValue() {
        return value;
    }

    public Expression getSlice() {
        return slice;
    }

    @Override
    public List<Node> getChildNodes() {
        return childrenOf(value, slice);
    }

    @Override
    public <A> void accept(VoidVisitor<A> v, A arg) {
        v.visit(this, arg);
    }
}
