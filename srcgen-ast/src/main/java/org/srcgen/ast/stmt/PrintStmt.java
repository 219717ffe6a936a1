package org.srcgen.ast.stmt;

import org.srcgen.ast.Node;
import org.srcgen.ast.expr.Expression;
import org.srcgen.ast.visitor.VoidVisitor;

import java.util.List;

/**
 * The statement form of {@code print}: optional {@code >> dest}, the values, and whether a
 * newline follows (no trailing comma).
 */
public class PrintStmt extends Statement {

    private final Expression destination;
    private final List<Expression> values;
    private final boolean newline;

    public PrintStmt(List<Expression> values) {
        this(0, null, values, true);
    }

    public PrintStmt(int line, Expression destination, List<Expression> values, boolean newline) {
        super(line);
        this.destination = destination;
        this.values = copyOf(values);
        this.newline = newline;
    }

    public Expression getDestination() {
        return destination;
    }

    public List<Expression> getValues() {
        return values;
    }

    public boolean isNewline() {
        return newline;
    }

    @Override
    public List<Node> getChildNodes() {
        return childrenOf(destination, values);
    }

    @Override
    public <A> void accept(VoidVisitor<A> v, A arg) {
        v.visit(this, arg);
    }
}
