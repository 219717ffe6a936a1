package org.srcgen.ast.expr;

import org.srcgen.ast.Comprehension;
import org.srcgen.ast.visitor.VoidVisitor;

import java.util.List;

public class SetCompExpr extends ComprehensionExpr {

    public SetCompExpr(Expression element, List<Comprehension> generators) {
        super(element, generators);
    }

    @Override
    public <A> void accept(VoidVisitor<A> v, A arg) {
        v.visit(this, arg);
    }
}
