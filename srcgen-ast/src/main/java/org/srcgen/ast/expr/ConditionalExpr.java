package org.srcgen.ast.expr;

import org.srcgen.ast.Node;
import org.srcgen.ast.visitor.VoidVisitor;

import java.util.List;

/**
 * The ternary {@code body if test else orElse}.
 */
public class ConditionalExpr extends Expression {

    private final Expression test;
    private final Expression body;
    private final Expression orElse;

    public ConditionalExpr(Expression test, Expression body, Expression orElse) {
        super(0);
        this.test = test;
        this.body = body;
        this.orElse = orElse;
    }

    public Expression getTest() {
        return test;
    }

    public Expression getBody() {
        return body;
    }

    public Expression getOrElse() {
        return orElse;
    }

    @Override
    public List<Node> getChildNodes() {
        return childrenOf(test, body, orElse);
    }

    @Override
    public <A> void accept(VoidVisitor<A> v, A arg) {
        v.visit(this, arg);
    }
}
