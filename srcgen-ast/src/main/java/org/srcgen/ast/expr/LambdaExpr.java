package org.srcgen.ast.expr;

import org.srcgen.ast.Arguments;
import org.srcgen.ast.Node;
import org.srcgen.ast.visitor.VoidVisitor;

import java.util.List;

public class LambdaExpr extends Expression {

    private final Arguments arguments;
    private final Expression body;

    public LambdaExpr(Arguments arguments, Expression body) {
        super(0);
        this.arguments = arguments;
        this.body = body;
    }

    public Arguments getArguments() {
        return arguments;
    }

    public Expression getBody() {
        return body;
    }

    @Override
    public List<Node> getChildNodes() {
        return childrenOf(arguments, body);
    }

    @Override
    public <A> void accept(VoidVisitor<A> v, A arg) {
        v.visit(this, arg);
    }
}
