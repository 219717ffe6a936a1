package org.srcgen.ast.expr;

import org.srcgen.ast.Node;
import org.srcgen.ast.visitor.VoidVisitor;

import java.util.List;

/**
 * A numeric literal kept as its source text together with the kind of number it denotes.
 */
public class NumberLiteralExpr extends Expression {

    public enum Kind {
        INT("int"),
        LONG("long"),
        FLOAT("float"),
        COMPLEX("complex");

        private final String typeName;

        Kind(String typeName) {
            this.typeName = typeName;
        }

        public String getTypeName() {
            return typeName;
        }
    }

    private final String value;
    private final Kind kind;

    public NumberLiteralExpr(int value) {
        this(Integer.toString(value), Kind.INT);
    }

    public NumberLiteralExpr(double value) {
        this(Double.toString(value), Kind.FLOAT);
    }

    public NumberLiteralExpr(String value, Kind kind) {
        super(0);
        this.value = value;
        this.kind = kind;
    }

    public String getValue() {
        return value;
    }

    public Kind getNumberKind() {
        return kind;
    }

    @Override
    public List<Node> getChildNodes() {
        return List.of();
    }

    @Override
    public <A> void accept(VoidVisitor<A> v, A arg) {
        v.visit(this, arg);
    }
}
