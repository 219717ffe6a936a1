package org.srcgen.ast.visitor;

import org.srcgen.ast.Node;
import org.srcgen.ast.Alias;
import org.srcgen.ast.Arguments;
import org.srcgen.ast.Comprehension;
import org.srcgen.ast.ExceptHandler;
import org.srcgen.ast.Keyword;
import org.srcgen.ast.Module;
import org.srcgen.ast.Parameter;
import org.srcgen.ast.TypeIgnore;
import org.srcgen.ast.expr.AttributeExpr;
import org.srcgen.ast.expr.BinaryExpr;
import org.srcgen.ast.expr.BooleanExpr;
import org.srcgen.ast.expr.BytesLiteralExpr;
import org.srcgen.ast.expr.CallExpr;
import org.srcgen.ast.expr.CompareExpr;
import org.srcgen.ast.expr.ConditionalExpr;
import org.srcgen.ast.expr.DictCompExpr;
import org.srcgen.ast.expr.DictExpr;
import org.srcgen.ast.expr.EllipsisExpr;
import org.srcgen.ast.expr.ExtSliceExpr;
import org.srcgen.ast.expr.GeneratorExpr;
import org.srcgen.ast.expr.IndexExpr;
import org.srcgen.ast.expr.LambdaExpr;
import org.srcgen.ast.expr.ListCompExpr;
import org.srcgen.ast.expr.ListExpr;
import org.srcgen.ast.expr.NameExpr;
import org.srcgen.ast.expr.NumberLiteralExpr;
import org.srcgen.ast.expr.ReprExpr;
import org.srcgen.ast.expr.SetCompExpr;
import org.srcgen.ast.expr.SetExpr;
import org.srcgen.ast.expr.SliceExpr;
import org.srcgen.ast.expr.StarredExpr;
import org.srcgen.ast.expr.StringLiteralExpr;
import org.srcgen.ast.expr.SubscriptExpr;
import org.srcgen.ast.expr.TupleExpr;
import org.srcgen.ast.expr.UnaryExpr;
import org.srcgen.ast.expr.YieldExpr;
import org.srcgen.ast.stmt.AssertStmt;
import org.srcgen.ast.stmt.AssignStmt;
import org.srcgen.ast.stmt.AugAssignStmt;
import org.srcgen.ast.stmt.BreakStmt;
import org.srcgen.ast.stmt.ClassDeclaration;
import org.srcgen.ast.stmt.ContinueStmt;
import org.srcgen.ast.stmt.DeleteStmt;
import org.srcgen.ast.stmt.ExpressionStmt;
import org.srcgen.ast.stmt.ForStmt;
import org.srcgen.ast.stmt.FunctionDeclaration;
import org.srcgen.ast.stmt.GlobalStmt;
import org.srcgen.ast.stmt.IfStmt;
import org.srcgen.ast.stmt.ImportFromStmt;
import org.srcgen.ast.stmt.ImportStmt;
import org.srcgen.ast.stmt.NonlocalStmt;
import org.srcgen.ast.stmt.PassStmt;
import org.srcgen.ast.stmt.PrintStmt;
import org.srcgen.ast.stmt.RaiseStmt;
import org.srcgen.ast.stmt.ReturnStmt;
import org.srcgen.ast.stmt.TryStmt;
import org.srcgen.ast.stmt.WhileStmt;
import org.srcgen.ast.stmt.WithStmt;

/**
 * A visitor that routes every node kind to {@link #defaultAction(Node, Object)}. Subclasses override
 * the kinds they handle and decide in {@code defaultAction} what happens to the rest.
 *
 * @param <A> the type of the argument passed down the walk
 */
public abstract class VoidVisitorWithDefaults<A> implements VoidVisitor<A> {

    /**
     * Invoked for every node kind the subclass does not override.
     */
    public abstract void defaultAction(Node n, A arg);

    @Override
    public void visit(Module n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(TypeIgnore n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(Arguments n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(Parameter n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(Keyword n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(Alias n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(Comprehension n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(ExceptHandler n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(AssertStmt n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(AssignStmt n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(AugAssignStmt n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(BreakStmt n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(ClassDeclaration n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(ContinueStmt n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(DeleteStmt n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(ExpressionStmt n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(ForStmt n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(FunctionDeclaration n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(GlobalStmt n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(IfStmt n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(ImportFromStmt n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(ImportStmt n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(NonlocalStmt n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(PassStmt n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(PrintStmt n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(RaiseStmt n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(ReturnStmt n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(TryStmt n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(WhileStmt n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(WithStmt n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(AttributeExpr n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(BinaryExpr n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(BooleanExpr n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(BytesLiteralExpr n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(CallExpr n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(CompareExpr n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(ConditionalExpr n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(DictCompExpr n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(DictExpr n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(EllipsisExpr n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(ExtSliceExpr n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(GeneratorExpr n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(IndexExpr n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(LambdaExpr n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(ListCompExpr n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(ListExpr n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(NameExpr n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(NumberLiteralExpr n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(ReprExpr n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(SetCompExpr n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(SetExpr n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(SliceExpr n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(StarredExpr n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(StringLiteralExpr n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(SubscriptExpr n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(TupleExpr n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(UnaryExpr n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(YieldExpr n, A arg) {
        defaultAction(n, arg);
    }
}
