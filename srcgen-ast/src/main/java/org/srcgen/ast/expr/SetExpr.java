package org.srcgen.ast.expr;

import org.srcgen.ast.Node;
import org.srcgen.ast.visitor.VoidVisitor;

import java.util.List;

public class SetExpr extends Expression {

    private final List<Expression> elements;

    public SetExpr(List<Expression> elements) {
        super(0);
        this.elements = copyOf(elements);
    }

    public List<Expression> getElements() {
        return elements;
    }

    @Override
    public List<Node> getChildNodes() {
        return childrenOf(elements);
    }

    @Override
    public <A> void accept(VoidVisitor<A> v, A arg) {
        v.visit(this, arg);
    }
}
