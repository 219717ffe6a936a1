package org.srcgen.ast.expr;

import org.srcgen.ast.Node;
import org.srcgen.ast.visitor.VoidVisitor;

import java.util.List;

public class BytesLiteralExpr extends Expression {

    private final String value;

    public BytesLiteralExpr(String value) {
        super(0);
        this.value = value;
    }

    /**
     * @return the unescaped literal content
     */
    public String getValue() {
        return value;
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
