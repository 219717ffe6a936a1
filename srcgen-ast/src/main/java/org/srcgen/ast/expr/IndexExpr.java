package org.srcgen.ast.expr;

import org.srcgen.ast.Node;
import org.srcgen.ast.visitor.VoidVisitor;

import java.util.List;

/**
 * A plain subscript index. It has no syntax of its own; emitters print the wrapped value.
 */
public class IndexExpr extends Expression {

    private final Expression value;

    public IndexExpr(Expression value) {
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
