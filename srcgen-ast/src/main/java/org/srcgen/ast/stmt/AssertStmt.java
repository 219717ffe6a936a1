package org.srcgen.ast.stmt;

import org.srcgen.ast.Node;
import org.srcgen.ast.expr.Expression;
import org.srcgen.ast.visitor.VoidVisitor;

import java.util.List;

public class AssertStmt extends Statement {

    private final Expression test;
    private final Expression message;

    public AssertStmt(Expression test, Expression message) {
        this(0, test, message);
    }

    public AssertStmt(int line, Expression test, Expression message) {
        super(line);
        this.test = test;
        this.message = message;
    }

    public Expression getTest() {
        return test;
    }

    public Expression getMessage() {
        return message;
    }

    @Override
    public List<Node> getChildNodes() {
        return childrenOf(test, message);
    }

    @Override
    public <A> void accept(VoidVisitor<A> v, A arg) {
        v.visit(this, arg);
    }
}
