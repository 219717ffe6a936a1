package org.srcgen.ast.expr;

import org.srcgen.ast.Node;
import org.srcgen.ast.visitor.VoidVisitor;

import java.util.List;

/**
 * {@code value.attribute}. As the function of a {@link CallExpr} it makes the call method-style,
 * with {@code value} as the receiver.
 */
public class AttributeExpr extends Expression {

    private final Expression value;
    private final String attribute;

    public AttributeExpr(Expression value, String attribute) {
        super(0);
        this.value = value;
        this.attribute = attribute;
    }

    public Expression getValue() {
        return value;
    }

    public String getAttribute() {
        return attribute;
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
