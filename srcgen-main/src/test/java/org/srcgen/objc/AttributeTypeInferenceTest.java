package org.srcgen.objc;

import org.junit.jupiter.api.Test;
import org.srcgen.ast.expr.AttributeExpr;
import org.srcgen.ast.expr.CallExpr;
import org.srcgen.ast.expr.DictExpr;
import org.srcgen.ast.expr.ListExpr;
import org.srcgen.ast.expr.NameExpr;
import org.srcgen.ast.expr.NumberLiteralExpr;
import org.srcgen.ast.expr.SetExpr;
import org.srcgen.ast.expr.StringLiteralExpr;
import org.srcgen.ast.expr.TupleExpr;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class AttributeTypeInferenceTest {

    @Test
    void call_isTypedAfterItsCallee() {
        CallExpr call = new CallExpr(new AttributeExpr(new NameExpr("models"), "Widget"), List.of());
        assertThat(AttributeTypeInference.infer(call)).contains("models.Widget id");
    }

    @Test
    void call_onComputedCalleeIsNotInferred() {
        CallExpr inner = new CallExpr(new NameExpr("factory"), List.of());
        assertThat(AttributeTypeInference.infer(new CallExpr(inner, List.of()))).isEmpty();
    }

    @Test
    void sequences_areArrays() {
        assertThat(AttributeTypeInference.infer(new ListExpr(List.of()))).contains("NSArray *");
        assertThat(AttributeTypeInference.infer(new TupleExpr(List.of()))).contains("NSArray *");
        assertThat(AttributeTypeInference.infer(new SetExpr(List.of()))).contains("NSArray *");
    }

    @Test
    void numbers_useTheirKind() {
        assertThat(AttributeTypeInference.infer(new NumberLiteralExpr(1))).contains("int");
        assertThat(AttributeTypeInference.infer(new NumberLiteralExpr(1.0))).contains("float");
        assertThat(AttributeTypeInference.infer(new NumberLiteralExpr("1L", NumberLiteralExpr.Kind.LONG))).contains("long");
    }

    @Test
    void stringsAndBooleans() {
        assertThat(AttributeTypeInference.infer(new StringLiteralExpr("x"))).contains("NSString *");
        assertThat(AttributeTypeInference.infer(new NameExpr("True"))).contains("BOOL");
        assertThat(AttributeTypeInference.infer(new NameExpr("False"))).contains("BOOL");
    }

    @Test
    void otherShapes_areNotInferred() {
        assertThat(AttributeTypeInference.infer(new NameExpr("None"))).isEmpty();
        assertThat(AttributeTypeInference.infer(new DictExpr(List.of(), List.of()))).isEmpty();
    }
}
