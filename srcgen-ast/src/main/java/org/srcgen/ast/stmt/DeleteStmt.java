package org.srcgen.ast.stmt;

import org.srcgen.ast.Node;
import org.srcgen.ast.expr.Expression;
import org.srcgen.ast.visitor.VoidVisitor;

import java.util.List;

public class DeleteStmt extends Statement {

    private final List<Expression> targets;

    public DeleteStmt(List<Expression> targets) {
        this(0, targets);
    }

    public DeleteStmt(int line, List<Expression> targets) {
        super(line);
        this.targets = copyOf(targets);
    }

    public List<Expression> getTargets() {
        return targets;
    }

    @Override
    public List<Node> getChildNodes() {
        return childrenOf(targets);
    }

    @Override
    public <A> void accept(VoidVisitor<A> v, A arg) {
        v.visit(this, arg);
    }
}
