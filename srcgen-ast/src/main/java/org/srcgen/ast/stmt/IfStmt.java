package org.srcgen.ast.stmt;

import org.srcgen.ast.Node;
import org.srcgen.ast.expr.Expression;
import org.srcgen.ast.visitor.VoidVisitor;

import java.util.List;

/**
 * {@code if} with an optional {@code else} arm. An {@code elif} chain is represented as an
 * {@code else} arm holding exactly one nested {@code IfStmt}.
 */
public class IfStmt extends Statement {

    private final Expression test;
    private final List<Statement> body;
    private final List<Statement> orElse;

    public IfStmt(Expression test, List<Statement> body) {
        this(0, test, body, List.of());
    }

    public IfStmt(Expression test, List<Statement> body, List<Statement> orElse) {
        this(0, test, body, orElse);
    }

    public IfStmt(int line, Expression test, List<Statement> body, List<Statement> orElse) {
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

    /**
     * @return the nested {@code if} when the else arm is exactly one {@code if}, i.e. an {@code elif}
     */
    public IfStmt getElif() {
        if (orElse.size() == 1 && orElse.get(0) instanceof IfStmt) {
            return (IfStmt) orElse.get(0);
        }
        return null;
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
