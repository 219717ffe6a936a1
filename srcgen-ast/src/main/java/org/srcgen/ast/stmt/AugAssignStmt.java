package org.srcgen.ast.stmt;

import org.srcgen.ast.Node;
import org.srcgen.ast.expr.BinaryExpr;
import org.srcgen.ast.expr.Expression;
import org.srcgen.ast.visitor.VoidVisitor;

import java.util.List;

public class AugAssignStmt extends Statement {

    private final Expression target;
    private final BinaryExpr.Operator operator;
    private final Expression value;

    public AugAssignStmt(Expression target, BinaryExpr.Operator operator, Expression value) {
        this(0, target, operator, value);
    }

    public AugAssignStmt(int line, Expression target, BinaryExpr.Operator operator, Expression value) {
        super(line);
        this.target = target;
        this.operator = operator;
        this.value = value;
    }

    public Expression getTarget() {
        return target;
    }

    public BinaryExpr.Operator getOperator() {
        return operator;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public List<Node> getChildNodes() {
        return childrenOf(target, value);
    }

    @Override
    public <A> void accept(VoidVisitor<A> v, A arg) {
        v.visit(this, arg);
    }
}
