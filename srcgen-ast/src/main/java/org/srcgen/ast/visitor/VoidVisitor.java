package org.srcgen.ast.visitor;

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
 * A visitor that does not return anything, with one method per node kind.
 * <p>
 * Adding a node kind adds a method here, so every visitor has to decide how to handle it before
 * the project compiles again.
 *
 * @param <A> the type of the argument passed down the walk
 */
public interface VoidVisitor<A> {

    void visit(Module n, A arg);

    void visit(TypeIgnore n, A arg);

    void visit(Arguments n, A arg);

    void visit(Parameter n, A arg);

    void visit(Keyword n, A arg);

    void visit(Alias n, A arg);

    void visit(Comprehension n, A arg);

    void visit(ExceptHandler n, A arg);

    void visit(AssertStmt n, A arg);

    void visit(AssignStmt n, A arg);

    void visit(AugAssignStmt n, A arg);

    void visit(BreakStmt n, A arg);

    void visit(ClassDeclaration n, A arg);

    void visit(ContinueStmt n, A arg);

    void visit(DeleteStmt n, A arg);

    void visit(ExpressionStmt n, A arg);

    void visit(ForStmt n, A arg);

    void visit(FunctionDeclaration n, A arg);

    void visit(GlobalStmt n, A arg);

    void visit(IfStmt n, A arg);

    void visit(ImportFromStmt n, A arg);

    void visit(ImportStmt n, A arg);

    void visit(NonlocalStmt n, A arg);

    void visit(PassStmt n, A arg);

    void visit(PrintStmt n, A arg);

    void visit(RaiseStmt n, A arg);

    void visit(ReturnStmt n, A arg);

    void visit(TryStmt n, A arg);

    void visit(WhileStmt n, A arg);

    void visit(WithStmt n, A arg);

    void visit(AttributeExpr n, A arg);

    void visit(BinaryExpr n, A arg);

    void visit(BooleanExpr n, A arg);

    void visit(BytesLiteralExpr n, A arg);

    void visit(CallExpr n, A arg);

    void visit(CompareExpr n, A arg);

    void visit(ConditionalExpr n, A arg);

    void visit(DictCompExpr n, A arg);

    void visit(DictExpr n, A arg);

    void visit(EllipsisExpr n, A arg);

    void visit(ExtSliceExpr n, A arg);

    void visit(GeneratorExpr n, A arg);

    void visit(IndexExpr n, A arg);

    void visit(LambdaExpr n, A arg);

    void visit(ListCompExpr n, A arg);

    void visit(ListExpr n, A arg);

    void visit(NameExpr n, A arg);

    void visit(NumberLiteralExpr n, A arg);

    void visit(ReprExpr n, A arg);

    void visit(SetCompExpr n, A arg);

    void visit(SetExpr n, A arg);

    void visit(SliceExpr n, A arg);

    void visit(StarredExpr n, A arg);

    void visit(StringLiteralExpr n, A arg);

    void visit(SubscriptExpr n, A arg);

    void visit(TupleExpr n, A arg);

    void visit(UnaryExpr n, A arg);

    void visit(YieldExpr n, A arg);
}
