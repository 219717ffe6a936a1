package org.srcgen.ast;

import org.srcgen.ast.expr.Expression;
import org.srcgen.ast.visitor.VoidVisitor;

import java.util.List;

/**
 * A {@code name=value} argument of a call or class definition. A {@code null} name stands for a
 * {@code **value} expansion.
 */
public class Keyword extends Node {

    private final String arg;
    private final Expression value;

    public Keyword(String arg, Expression value) {
        super(0);
        this.arg = arg;
        this.value = value;
    }

    public String getArg() {
        return arg;
    }

    public Expression getValue() {
        return value;
    }

    public boolean isExpansion() {
        return arg == null;
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
