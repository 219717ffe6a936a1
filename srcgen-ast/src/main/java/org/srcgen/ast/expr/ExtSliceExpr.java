package org.srcgen.ast.expr;

import org.srcgen.ast.Node;
import org.srcgen.ast.visitor.VoidVisitor;

import java.util.List;

public class ExtSliceExpr extends Expression {

    private final List<Expression> dimensions;

    public ExtSliceExpr(List<Expression> dimensions) {
        super(0);
        this.dimensions = copyOf(dimensions);
    }

    public List<Expression> getDimensions() {
        return dimensions;
    }

    @Override
    public List<Node> getChildNodes() {
        return childrenOf(dimensions);
    }

    @Override
    public <A> void accept(VoidVisitor<A> v, A arg) {
        v.visit(this, arg);
    }
}
