package org.srcgen.ast.expr;

import org.srcgen.ast.Node;
import org.srcgen.ast.visitor.VoidVisitor;

import java.util.List;

public class EllipsisExpr extends Expression {

    public EllipsisExpr() {
        super(0);
    }

    @Override
    public List<Node> getChildNodes() {
        return List.of();
    }

    @Override
    public <A> void accept(VoidVisitor<A> v, A arg) {
        v.visit(this, arg);
    }
}
