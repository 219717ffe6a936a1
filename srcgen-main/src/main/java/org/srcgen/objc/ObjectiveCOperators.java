package org.srcgen.objc;

import org.srcgen.UnmappedOperatorException;
import org.srcgen.ast.expr.BinaryExpr;
import org.srcgen.ast.expr.BooleanExpr;
import org.srcgen.ast.expr.CompareExpr;
import org.srcgen.ast.expr.UnaryExpr;

/**
 * C symbols of the tree's operators. Operators without a C counterpart throw
 * {@link UnmappedOperatorException}.
 */
public final class ObjectiveCOperators {

    static final String BACKEND = "Objective-C";

    private ObjectiveCOperators() {
    }

    public static String symbol(BinaryExpr.Operator operator) {
        return switch (operator) {
            case ADD -> "+";
            case SUB -> "-";
            case MULT -> "*";
            case DIV -> "/";
            case MOD -> "%";
            case LSHIFT -> "<<";
            case RSHIFT -> ">>";
            case BIT_OR -> "|";
            case BIT_XOR -> "^";
            case BIT_AND -> "&";
            case MAT_MULT, FLOOR_DIV, POW -> throw new UnmappedOperatorException(operator, BACKEND);
        };
    }

    public static String symbol(BooleanExpr.Operator operator) {
        return switch (operator) {
            case AND -> "&&";
            case OR -> "||";
        };
    }

    public static String symbol(CompareExpr.Operator operator) {
        return switch (operator) {
            case EQ, IS -> "==";
            case NOT_EQ, IS_NOT -> "!=";
            case LT -> "<";
            case LT_E -> "<=";
            case GT -> ">";
            case GT_E -> ">=";
            case IN, NOT_IN -> throw new UnmappedOperatorException(operator, BACKEND);
        };
    }

    public static String symbol(UnaryExpr.Operator operator) {
        return switch (operator) {
            case INVERT -> "~";
            case NOT -> "!";
            case PLUS -> "+";
            case MINUS -> "-";
        };
    }
}
