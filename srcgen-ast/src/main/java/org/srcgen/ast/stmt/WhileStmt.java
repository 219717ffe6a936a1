package org.srcgen.ast.stmt;

import org.srcgen.ast.Node;
import org.srcgen.ast.expr.Expression;
import org.srcgen.ast.visitor.VoidVisitor;

import java.util.List;

public class WhileStmt extends Statement {

    private final Expression test;
    private final List<Statement> body;
    private final List<Statement> orElse;

    public WhileStmt(Expression test, List<Statement> body) {
        this(0, test, body, List.of());
    }

    public WhileStmt(int line, Expression test, List<Statement> body, List<Statement> orElse) {
        super(line);
        this.test = test;
        this.body = copyOf(body);
        this.orElse = copyOf(orElse);
    }

    public Expression getTest() {
        return test;
    }

    public List<Statement> getBody() {
        return body;
    }

    public List<Statement> getOrElse() {
        return orElse;
    }

    @Override
    public List<Node> getChildNodes() {
        return childrenOf(test, body, orElse);
    }

    @Override
    public <A> void accept(VoidVisitor<A> v, A arg) {
        v.visit(this, arg);
    }
}
