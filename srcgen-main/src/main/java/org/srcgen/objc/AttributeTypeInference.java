package org.srcgen.objc;

import org.srcgen.ast.expr.AttributeExpr;
import org.srcgen.ast.expr.CallExpr;
import org.srcgen.ast.expr.Expression;
import org.srcgen.ast.expr.ListExpr;
import org.srcgen.ast.expr.NameExpr;
import org.srcgen.ast.expr.NumberLiteralExpr;
import org.srcgen.ast.expr.SetExpr;
import org.srcgen.ast.expr.StringLiteralExpr;
import org.srcgen.ast.expr.TupleExpr;

import java.util.Optional;

/**
 * Guesses the declared type of a class-level attribute from the shape of the value assigned to
 * it. Rules are tried in order and the first match wins.
 */
public final class AttributeTypeInference {

    public static final String ARRAY_TYPE = "NSArray *";
    public static final String STRING_TYPE = "NSString *";
    public static final String BOOLEAN_TYPE = "BOOL";

    private AttributeTypeInference() {
    }

    /**
     * @return the inferred type, or empty when the value has no matching rule
     */
    public static Optional<String> infer(Expression value) {
        if (value instanceof CallExpr) {
            return dottedName(((CallExpr) value).getFunction()).map(callee -> callee + " id");
        }
        if (value instanceof ListExpr || value instanceof TupleExpr || value instanceof SetExpr) {
            return Optional.of(ARRAY_TYPE);
        }
        if (value instanceof NumberLiteralExpr) {
            return Optional.of(((NumberLiteralExpr) value).getNumberKind().getTypeName());
        }
        if (value instanceof StringLiteralExpr) {
            return Optional.of(STRING_TYPE);
        }
        if (value instanceof NameExpr) {
            String id = ((NameExpr) value).getId();
            if (id.equals("True") || id.equals("False")) {
                return Optional.of(BOOLEAN_TYPE);
            }
        }
        return Optional.empty();
    }

    /**
     * Renders a name or a chain of attribute accesses on a name, such as {@code foo.Bar}.
     */
    static Optional<String> dottedName(Expression expression) {
        if (expression instanceof NameExpr) {
            return Optional.of(((NameExpr) expression).getId());
        }
        if (expression instanceof AttributeExpr) {
            AttributeExpr attribute = (AttributeExpr) expression;
            return dottedName(attribute.getValue()).map(owner -> owner + "." + attribute.getAttribute());
        }
        return Optional.empty();
    }
}
