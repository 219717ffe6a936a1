package org.srcgen.ast.stmt;

import org.srcgen.ast.Node;
import org.srcgen.ast.expr.Expression;
import org.srcgen.ast.visitor.VoidVisitor;

import java.util.List;

public class ForStmt extends Statement {

    private final Expression target;
    private final Expression iter;
    private final List<Statement> body;
    private final List<Statement> orElse;

    public ForStmt(Expression target, Expression iter, List<Statement> body) {
        this(0, target, iter, body, List.of());
    }

    public ForStmt(int line, Expression target, Expression iter, List<Statement> body, List<Statement> orElse) {
        super(line);
        this.target = target;
        this.iter = iter;
        this.body = copyOf(body);
        this.orElse = copyOf(orElse);
    }

    public Expression getTarget() {
        return target;
    }

    public Expression getIter() {
        return iter;
    }

    public List<Statement> getBody() {
        return body;
    }

    public List<Statement> getOrElse() {
        return orElse;
    }

    @Override
    public List<Node> getChildNodes() {
        return childrenOf(target, iter, body, orElse);
    }

    @Override
    public <A> void accept(VoidVisitor<A> v, A arg) {
        v.visit(this, arg);
    }
}
