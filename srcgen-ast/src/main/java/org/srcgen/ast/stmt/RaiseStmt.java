package org.srcgen.ast.stmt;

import org.srcgen.ast.Node;
import org.srcgen.ast.expr.Expression;
import org.srcgen.ast.visitor.VoidVisitor;

import java.util.List;

public class RaiseStmt extends Statement {

    private final Expression exception;
    private final Expression cause;

    public RaiseStmt(Expression exception) {
        this(0, exception, null);
    }

    public RaiseStmt(int line, Expression exception, Expression cause) {
        super(line);
        this.exception = exception;
        this.cause = cause;
    }

    public Expression getException() {
        return exception;
    }

    public Expression getCause() {
        return cause;
    }

    @Override
    public List<Node> getChildNodes() {
        return childrenOf(exception, cause);
    }

    @Override
    public <A> void accept(VoidVisitor<A> v, A arg) {
        v.visit(this, arg);
    }
}
