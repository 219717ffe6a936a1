package org.srcgen.ast.expr;

import org.srcgen.ast.Node;
import org.srcgen.ast.visitor.VoidVisitor;

import java.util.List;

/**
 * The backtick form {@code `value`}.
 */
public class ReprExpr extends Expression {

    private final Expression value;

    public ReprExpr(Expression value) {
        super(0);
        this.value = value;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public List<Node> getChildNodes() {
        return childrenOf(value);
    }

    @Override
    public <A> void accept(VoidVisitor<A> v, A arg) {
        v.visit(this, arg);
    }
}
