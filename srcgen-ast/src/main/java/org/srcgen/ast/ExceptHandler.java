package org.srcgen.ast;

import org.srcgen.ast.expr.Expression;
import org.srcgen.ast.stmt.Statement;
import org.srcgen.ast.visitor.VoidVisitor;

import java.util.List;

/**
 * An {@code except} clause. A {@code null} type is a bare catch-all handler.
 */
public class ExceptHandler extends Node {

    private final Expression type;
    private final String name;
    private final List<Statement> body;

    public ExceptHandler(Expression type, String name, List<Statement> body) {
        this(0, type, name, body);
    }

    public ExceptHandler(int line, Expression type, String name, List<Statement> body) {
        super(line);
        this.type = type;
        this.name = name;
        this.body = copyOf(body);
    }

    public Expression getType() {
        return type;
    }

    public String getName() {
        return name;
    }

    public List<Statement> getBody() {
        return body;
    }

    public boolean isBare() {
        return type == null;
    }

    @Override
    public List<Node> getChildNodes() {
        return childrenOf(type, body);
    }

    @Override
    public <A> void accept(VoidVisitor<A> v, A arg) {
        v.visit(this, arg);
    }
}
