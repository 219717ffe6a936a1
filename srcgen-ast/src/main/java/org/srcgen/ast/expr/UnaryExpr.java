package org.srcgen.ast.expr;

import org.srcgen.ast.Node;
import org.srcgen.ast.visitor.VoidVisitor;

import java.util.List;

public class UnaryExpr extends Expression {

    public enum Operator {
        INVERT("~"),
        NOT("not"),
        PLUS("+"),
        MINUS("-");

        private final String codeRepresentation;

        Operator(String codeRepresentation) {
            this.codeRepresentation = codeRepresentation;
        }

        public String asString() {
            return codeRepresentation;
        }

        /**
         * @return whether the symbol is a word and needs a space before its operand
         */
        public boolean isKeyword() {
            return Character.isLetter(codeRepresentation.charAt(0));
        }
    }

    private final Operator operator;
    private final Expression operand;

    public UnaryExpr(Operator operator, Expression operand) {
        super(0);
        this.operator = operator;
        this.operand = operand;
    }

    public Operator getOperator() {
        return operator;
    }

    public Expression getOperand() {
        return operand;
    }

    @Override
    public List<Node> getChildNodes() {
        return childrenOf(operand);
    }

    @Override
    public <A> void accept(VoidVisitor<A> v, A arg) {
        v.visit(this, arg);
    }
}
