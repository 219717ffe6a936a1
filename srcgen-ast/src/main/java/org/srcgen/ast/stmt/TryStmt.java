package org.srcgen.ast.stmt;

import org.srcgen.ast.ExceptHandler;
import org.srcgen.ast.Node;
import org.srcgen.ast.visitor.VoidVisitor;

import java.util.List;

/**
 * {@code try} with its handlers, the {@code else} arm that runs only when nothing was raised, and
 * the {@code finally} arm.
 */
public class TryStmt extends Statement {

    private final List<Statement> body;
    private final List<ExceptHandler> handlers;
    private final List<Statement> orElse;
    private final List<Statement> finalBody;

    public TryStmt(List<Statement> body, List<ExceptHandler> handlers) {
        this(0, body, handlers, List.of(), List.of());
    }

    public TryStmt(int line, List<Statement> body, List<ExceptHandler> handlers, List<Statement> orElse,
                   List<Statement> finalBody) {
        super(line);
        this.body = copyOf(body);
        this.handlers = copyOf(handlers);
        this.orElse = copyOf(orElse);
        this.finalBody = copyOf(finalBody);
    }

    public List<Statement> getBody() {
        return body;
    }

    public List<ExceptHandler> getHandlers() {
        return handlers;
    }

    public List<Statement> getOrElse() {
        return orElse;
    }

    public List<Statement> getFinalBody() {
        return finalBody;
    }

    @Override
    public List<Node> getChildNodes() {
        return childrenOf(body, handlers, orElse, finalBody);
    }

    @Override
    public <A> void accept(VoidVisitor<A> v, A arg) {
        v.visit(this, arg);
    }
}
