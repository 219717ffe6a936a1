package org.srcgen.ast.stmt;

import org.srcgen.ast.Node;
import org.srcgen.ast.expr.Expression;
import org.srcgen.ast.visitor.VoidVisitor;

import java.util.List;

/**
 * {@code t1 = t2 = value}. Several targets mean chained assignment, not tuple unpacking.
 */
public class AssignStmt extends Statement {

    private final List<Expression> targets;
    private final Expression value;

    public AssignStmt(Expression target, Expression value) {
        this(0, List.of(target), value);
    }

    public AssignStmt(int line, List<Expression> targets, Expression value) {
        super(line);
        this.targets = copyOf(targets);
        this.value = value;
    }

    public List<Expression> getTargets() {
        return targets;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public List<Node> getChildNodes() {
        return childrenOf(targets, value);
    }

    @Override
    public <A> void accept(VoidVisitor<A> v, A arg) {
        v.visit(this, arg);
    }
}
