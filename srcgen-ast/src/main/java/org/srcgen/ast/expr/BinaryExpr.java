package org.srcgen.ast.expr;

import org.srcgen.ast.Node;
import org.srcgen.ast.visitor.VoidVisitor;

import java.util.List;

public class BinaryExpr extends Expression {

    public enum Operator {
        ADD("+"),
        SUB("-"),
        MULT("*"),
        MAT_MULT("@"),
        DIV("/"),
        FLOOR_DIV("//"),
        MOD("%"),
        POW("**"),
        LSHIFT("<<"),
        RSHIFT(">>"),
        BIT_OR("|"),
        BIT_XOR("^"),
        BIT_AND("&");

        private final String codeRepresentation;

        Operator(String codeRepresentation) {
            this.codeRepresentation = codeRepresentation;
        }

        public String asString() {
            return codeRepresentation;
        }
    }

    private final Expression left;
    private final Operator operator;
    private final Expression right;

    public BinaryExpr(Expression left, Operator operator, Expression right) {
        super(0);
        this.left = left;
        this.operator = operator;
        this.right = right;
    }

    public Expression getLeft() {
        return left;
    }

    public Operator getOperator() {
        return operator;
    }

    public Expression getRight() {
        return right;
    }

    @Override
    public List<Node> getChildNodes() {
        return childrenOf(left, right);
    }

    @Override
    public <A> void accept(VoidVisitor<A> v, A arg) {
        v.visit(this, arg);
    }
}
