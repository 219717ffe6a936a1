package org.srcgen.ast.stmt;

import org.srcgen.ast.Node;
import org.srcgen.ast.expr.Expression;
import org.srcgen.ast.visitor.VoidVisitor;

import java.util.List;

public class WithStmt extends Statement {

    private final Expression contextExpression;
    private final Expression optionalVars;
    private final List<Statement> body;

    public WithStmt(Expression contextExpression, Expression optionalVars, List<Statement> body) {
        this(0, contextExpression, optionalVars, body);
    }

    public WithStmt(int line, Expression contextExpression, Expression optionalVars, List<Statement> body) {
        super(line);
        this.contextExpression = contextExpression;
        this.optionalVars = optionalVars;
        this.body = copyOf(body);
    }

    public Expression getContextExpression() {
        return contextExpression;
    }

    public Expression getOptionalVars() {
        return optionalVars;
    }

    public List<Statement> getBody() {
        return body;
    }

    @Override
    public List<Node> getChildNodes() {
        return childrenOf(contextExpression, optionalVars, body);
    }

    @Override
    public <A> void accept(VoidVisitor<A> v, A arg) {
        v.visit(this, arg);
    }
}
