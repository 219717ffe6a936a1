package org.srcgen.ast.stmt;

import org.srcgen.ast.Node;
import org.srcgen.ast.expr.Expression;
import org.srcgen.ast.visitor.VoidVisitor;

import java.util.List;

/**
 * An expression evaluated for its side effects, typically a call.
 */
public class ExpressionStmt extends Statement {

    private final Expression expression;

    public ExpressionStmt(Expression expression) {
        this(0, expression);
    }

    public ExpressionStmt(int line, Expression expression) {
        super(line);
        this.expression = expression;
    }

    public Expression getExpression() {
        return expression;
    }

    @Override
    public List<Node> getChildNodes() {
        return childrenOf(expression);
    }

    @Override
    public <A> void accept(VoidVisitor<A> v, A arg) {
        v.visit(this, arg);
    }
}
