package org.srcgen.benchmark.domain;

import org.srcgen.ast.Arguments;
import org.srcgen.ast.Parameter;
import org.srcgen.ast.expr.AttributeExpr;
import org.srcgen.ast.expr.BinaryExpr;
import org.srcgen.ast.expr.CallExpr;
import org.srcgen.ast.expr.CompareExpr;
import org.srcgen.ast.expr.Expression;
import org.srcgen.ast.expr.ListExpr;
import org.srcgen.ast.expr.NameExpr;
import org.srcgen.ast.expr.NumberLiteralExpr;
import org.srcgen.ast.expr.StringLiteralExpr;
import org.srcgen.ast.stmt.AssignStmt;
import org.srcgen.ast.stmt.AugAssignStmt;
import org.srcgen.ast.stmt.ClassDeclaration;
import org.srcgen.ast.stmt.ExpressionStmt;
import org.srcgen.ast.stmt.ForStmt;
import org.srcgen.ast.stmt.FunctionDeclaration;
import org.srcgen.ast.stmt.IfStmt;
import org.srcgen.ast.stmt.ReturnStmt;
import org.srcgen.ast.stmt.Statement;
import org.srcgen.ast.Module;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds synthetic trees of a chosen size. Every tree is accepted by both backends.
 */
public final class SampleTrees {

    private SampleTrees() {
    }

    /**
     * A module with {@code classCount} classes, each with class-level attributes, an initializer
     * and {@code methodsPerClass} methods containing loops, conditionals and message sends.
     */
    public static Module module(int classCount, int methodsPerClass) {
        List<Statement> body = new ArrayList<>();
        for (int c = 0; c < classCount; c++) {
            body.add(faction("Faction" + c, methodsPerClass));
        }
        body.add(new FunctionDeclaration("main", Arguments.of(), List.of(
                new AssignStmt(new NameExpr("f"), new CallExpr(new NameExpr("Faction0"), List.of())),
                new ExpressionStmt(new CallExpr(new AttributeExpr(new NameExpr("f"), "tick_"),
                                                List.of(new NumberLiteralExpr(1)))))));
        return new Module(body);
    }

    private static ClassDeclaration faction(String name, int methods) {
        List<Statement> body = new ArrayList<>();
        body.add(new AssignStmt(new NameExpr("influence"), new NumberLiteralExpr(0)));
        body.add(new AssignStmt(new NameExpr("label"), new StringLiteralExpr(name)));
        body.add(new AssignStmt(new NameExpr("allies"), new ListExpr(List.of())));
        body.add(new FunctionDeclaration("__init__", Arguments.of("self", "influence"), List.of(
                new AssignStmt(self("influence"), new NameExpr("influence")))));
        for (int m = 0; m < methods; m++) {
            body.add(method("adjust_by_" + m + "_", m));
        }
        return new ClassDeclaration(name, List.of(new NameExpr("Base")), body);
    }

    private static FunctionDeclaration method(String name, int m) {
        Expression self = new NameExpr("self");
        List<Statement> loop = List.of(
                new IfStmt(new CompareExpr(new NameExpr("ally"), CompareExpr.Operator.GT, new NumberLiteralExpr(m)),
                           List.of(new AugAssignStmt(self("influence"), BinaryExpr.Operator.ADD, new NameExpr("amount"))),
                           List.of(new ExpressionStmt(new CallExpr(new AttributeExpr(self, "notify_of_"),
                                                                   List.of(new NameExpr("ally"), new NameExpr("amount")))))));
        return new FunctionDeclaration(name, new Arguments(List.of(new Parameter("self"), new Parameter("amount"))), List.of(
                new ForStmt(new NameExpr("ally"), self("allies"), loop),
                new ReturnStmt(new BinaryExpr(self("influence"), BinaryExpr.Operator.MULT, new NumberLiteralExpr(2)))));
    }

    private static Expression self(String attribute) {
        return new AttributeExpr(new NameExpr("self"), attribute);
    }
}
